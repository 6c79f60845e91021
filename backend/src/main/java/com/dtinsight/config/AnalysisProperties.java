package com.dtinsight.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {
    private static final String DEFAULT_IDENTIFIER_COLUMN = "股票代码";

    private Columns columns = new Columns();
    private Defaults defaults = new Defaults();
    private Data data = new Data();
    private Cli cli = new Cli();

    public Columns getColumns() {
        return columns;
    }

    public void setColumns(Columns columns) {
        this.columns = columns;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeColumnName(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_IDENTIFIER_COLUMN;
        }
        return candidate.trim();
    }

    private static List<String> cleanNames(List<String> names) {
        List<String> cleaned = new ArrayList<>();
        if (names == null) {
            return cleaned;
        }
        for (String name : names) {
            if (name != null && !name.isBlank() && !cleaned.contains(name.trim())) {
                cleaned.add(name.trim());
            }
        }
        return cleaned;
    }

    public static class Columns {
        private String identifier = DEFAULT_IDENTIFIER_COLUMN;
        private List<String> identifierCandidates = new ArrayList<>(
            List.of(DEFAULT_IDENTIFIER_COLUMN, "stock code", "Stock Code", "stock_code"));
        private List<String> anonymousIndexNames = new ArrayList<>(List.of("Unnamed: 0", "unnamed index"));
        private List<String> groupingCandidates = new ArrayList<>(List.of(
            "行业", "所属行业", "行业分类", "industry", "Industry", "affiliated industry", "industry classification"));
        private List<String> nameCandidates = new ArrayList<>(List.of("企业名称", "company name", "Company Name"));

        /**
         * Column name the loader gives to an anonymous leading index column.
         */
        public String getIdentifier() {
            return normalizeColumnName(identifier);
        }

        public void setIdentifier(String identifier) {
            this.identifier = normalizeColumnName(identifier);
        }

        public List<String> getIdentifierCandidates() {
            List<String> names = cleanNames(identifierCandidates);
            if (!names.contains(getIdentifier())) {
                names.add(0, getIdentifier());
            }
            return names;
        }

        public void setIdentifierCandidates(List<String> identifierCandidates) {
            this.identifierCandidates = identifierCandidates;
        }

        public List<String> getAnonymousIndexNames() {
            return cleanNames(anonymousIndexNames);
        }

        public void setAnonymousIndexNames(List<String> anonymousIndexNames) {
            this.anonymousIndexNames = anonymousIndexNames;
        }

        public List<String> getGroupingCandidates() {
            return cleanNames(groupingCandidates);
        }

        public void setGroupingCandidates(List<String> groupingCandidates) {
            this.groupingCandidates = groupingCandidates;
        }

        public List<String> getNameCandidates() {
            return cleanNames(nameCandidates);
        }

        public void setNameCandidates(List<String> nameCandidates) {
            this.nameCandidates = nameCandidates;
        }
    }

    public static class Defaults {
        private String preferredMetric = "数字化转型总指数";
        private String secondaryMetric = "技术应用";
        private List<String> keyMetrics = new ArrayList<>(
            List.of("数字化转型总指数", "战略转型", "技术应用", "组织变革", "数据价值", "流程优化"));
        private int rankingLimit = 10;
        private int minRankingLimit = 5;
        private int maxRankingLimit = 50;
        private int histogramBins = 20;
        private int comparisonCap = 10;
        private int previewRows = 5;

        public String getPreferredMetric() {
            return preferredMetric;
        }

        public void setPreferredMetric(String preferredMetric) {
            this.preferredMetric = preferredMetric == null ? null : preferredMetric.trim();
        }

        public String getSecondaryMetric() {
            return secondaryMetric;
        }

        public void setSecondaryMetric(String secondaryMetric) {
            this.secondaryMetric = secondaryMetric == null ? null : secondaryMetric.trim();
        }

        public List<String> getKeyMetrics() {
            return cleanNames(keyMetrics);
        }

        public void setKeyMetrics(List<String> keyMetrics) {
            this.keyMetrics = keyMetrics;
        }

        public int getRankingLimit() {
            return Math.max(getMinRankingLimit(), Math.min(rankingLimit, getMaxRankingLimit()));
        }

        public void setRankingLimit(int rankingLimit) {
            this.rankingLimit = Math.max(1, rankingLimit);
        }

        public int getMinRankingLimit() {
            return Math.max(1, minRankingLimit);
        }

        public void setMinRankingLimit(int minRankingLimit) {
            this.minRankingLimit = Math.max(1, minRankingLimit);
        }

        public int getMaxRankingLimit() {
            return Math.max(getMinRankingLimit(), maxRankingLimit);
        }

        public void setMaxRankingLimit(int maxRankingLimit) {
            this.maxRankingLimit = Math.max(1, maxRankingLimit);
        }

        public int getHistogramBins() {
            return Math.max(1, histogramBins);
        }

        public void setHistogramBins(int histogramBins) {
            this.histogramBins = Math.max(1, histogramBins);
        }

        public int getComparisonCap() {
            return Math.max(1, comparisonCap);
        }

        public void setComparisonCap(int comparisonCap) {
            this.comparisonCap = Math.max(1, comparisonCap);
        }

        public int getPreviewRows() {
            return Math.max(1, previewRows);
        }

        public void setPreviewRows(int previewRows) {
            this.previewRows = Math.max(1, previewRows);
        }
    }

    public static class Data {
        private String defaultFile = "../data/merged_data.xlsx";
        private boolean loadOnStartup = true;

        public String getDefaultFile() {
            return defaultFile;
        }

        public void setDefaultFile(String defaultFile) {
            this.defaultFile = defaultFile;
        }

        public boolean isLoadOnStartup() {
            return loadOnStartup;
        }

        public void setLoadOnStartup(boolean loadOnStartup) {
            this.loadOnStartup = loadOnStartup;
        }
    }

    public static class Cli {
        private boolean run;
        private String query = "";
        private int limit = 10;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query == null ? "" : query;
        }

        public int getLimit() {
            return Math.max(1, limit);
        }

        public void setLimit(int limit) {
            this.limit = Math.max(1, limit);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
