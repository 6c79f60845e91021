package com.dtinsight.analysis.model;

public record ValueRange(double low, double high) {}
