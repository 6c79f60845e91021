package com.dtinsight.analysis.model;

public record CorrelationPoint(String label, long identifier, String group, double x, double y) {}
