package com.investidor.backend.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.investidor.backend.classification.Verdict;

public record FieldView(String value, @JsonProperty("class") Verdict verdict) {}
