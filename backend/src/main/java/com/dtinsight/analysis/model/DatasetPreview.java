package com.dtinsight.analysis.model;

import java.util.List;

public record DatasetPreview(List<String> columns, int totalRecords, List<CompanyRecord> rows) {}
