package com.mtsa.findings.dto;

import java.util.List;
import java.util.Map;

public record FindingsStatistics(long activeRecords,
                                 Map<String, Long> byLanguage,
                                 Map<String, Long> byAnalysisType,
                                 List<AccessedCombination> mostAccessed,
                                 Map<String, Long> jobsByStatus,
                                 long cacheHits,
                                 long cacheMisses,
                                 List<GeneratorPerformance> generators) {

    public record AccessedCombination(String combinationHash, String tool, List<String> sources,
                                      String language, long accessCount) {
    }
}
