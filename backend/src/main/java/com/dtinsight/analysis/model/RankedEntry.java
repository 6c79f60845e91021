package com.dtinsight.analysis.model;

public record RankedEntry(int rank, long identifier, String name, Double value, CompanyRecord record) {}
