package com.mtsa.findings.service;

import com.mtsa.findings.model.CombinationKey;
import com.mtsa.findings.model.DatasetSummary;

public interface DatasetSummaryProvider {

    /**
     * Deterministic summary of the data behind a combination.
     */
    DatasetSummary summarize(CombinationKey key);
}
