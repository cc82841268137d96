package com.mtsa.findings.model;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {

    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public static final Set<JobStatus> LIVE = EnumSet.of(PENDING, RUNNING);

    public boolean isLive() {
        return LIVE.contains(this);
    }
}
