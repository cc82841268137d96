package com.mtsa.findings.model;

/**
 * Secondary-lookup filter over stored records. Null components match everything.
 */
public record FindingsFilter(String tool, AnalysisType analysisType, String language) {

    public static FindingsFilter all() {
        return new FindingsFilter(null, null, null);
    }
}
