package com.dtinsight.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record MatchResult(List<CompanyRecord> records) {
    public MatchResult {
        records = List.copyOf(records);
    }

    public static MatchResult empty() {
        return new MatchResult(List.of());
    }

    public int size() {
        return records.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return records.isEmpty();
    }
}
