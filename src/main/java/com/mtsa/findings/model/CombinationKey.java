package com.mtsa.findings.model;

import java.util.List;
import java.util.Objects;

/**
 * Canonical identity of one cacheable analysis: normalized tool, sorted de-duplicated sources and
 * language, plus the canonical serialization and its digest. Instances come from
 * {@code CombinationKeyFactory}; two keys are equal exactly when their hashes are equal.
 */
public record CombinationKey(String tool,
                             List<String> sources,
                             String language,
                             String canonicalForm,
                             String hash) {

    public CombinationKey {
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(canonicalForm, "canonicalForm");
        Objects.requireNonNull(hash, "hash");
        sources = List.copyOf(sources);
    }

    public int sourceCount() {
        return sources.size();
    }

    public AnalysisType analysisType() {
        return AnalysisType.forSourceCount(sources.size());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CombinationKey other && hash.equals(other.hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return tool + sources + "/" + language + "#" + hash.substring(0, Math.min(10, hash.length()));
    }
}
