package com.investidor.backend.classification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class ClassifiedFieldSet {

    private static final ClassifiedFieldSet UNAVAILABLE = new ClassifiedFieldSet(Map.of(), false);

    private final Map<String, ClassifiedField> fields;
    private final boolean available;

    private ClassifiedFieldSet(Map<String, ClassifiedField> fields, boolean available) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.available = available;
    }

    public static ClassifiedFieldSet of(Map<String, ClassifiedField> fields) {
        return new ClassifiedFieldSet(fields, true);
    }

    public static ClassifiedFieldSet unavailable() {
        return UNAVAILABLE;
    }

    public ClassifiedField get(String fieldName) {
        return fields.getOrDefault(fieldName, ClassifiedField.absent());
    }

    public ClassifiedFieldSet with(String fieldName, ClassifiedField field) {
        Map<String, ClassifiedField> copy = new LinkedHashMap<>(fields);
        copy.put(fieldName, field);
        return new ClassifiedFieldSet(copy, available);
    }

    public boolean isAvailable() {
        return available;
    }
}
