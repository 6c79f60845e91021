package com.dtinsight.analysis.model;

public record HistogramBin(double lower, double upper, int count) {}
