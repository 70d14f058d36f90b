package com.investidor.backend.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class RawFieldSet {

    private final ProviderId providerId;
    private final Map<String, String> fields;

    public RawFieldSet(ProviderId providerId, Map<String, String> fields) {
        this.providerId = providerId;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
    }

    public ProviderId getProviderId() {
        return providerId;
    }

    public String get(String fieldName) {
        return fields.get(fieldName);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    @Override
    public String toString() {
        return "RawFieldSet{providerId=" + providerId + ", fields=" + fields + '}';
    }
}
