package com.dtinsight.analysis.model;

public record GroupCount(String group, int count) {}
