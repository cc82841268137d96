package com.mtsa.findings.model;

/**
 * Why a findings record changed.
 */
public enum HistoryChangeType {
    /** First record stored for a combination. */
    CREATED,
    /** Replaced by content at a newer schema version, or over an inactive row. */
    SUPERSEDED,
    /** Regenerated on request at the same schema version. */
    REFRESHED,
    /** Soft-invalidated; content kept on the record itself. */
    INVALIDATED
}
