package com.dtinsight.analysis.model;

public record LongRecord(String entityKey, String metric, Double value) {}
