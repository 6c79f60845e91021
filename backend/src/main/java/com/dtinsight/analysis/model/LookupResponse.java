package com.dtinsight.analysis.model;

import java.util.List;

public record LookupResponse(String query, LookupField field, LookupMode mode, int matchCount, List<CompanyRecord> matches) {}
