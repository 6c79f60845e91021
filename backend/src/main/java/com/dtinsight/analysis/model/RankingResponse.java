package com.dtinsight.analysis.model;

import java.util.List;

public record RankingResponse(String metric, RankDirection direction, int limit, List<RankedEntry> entries) {}
