package com.mtsa.findings.service;

import java.util.EnumSet;
import java.util.Set;

/**
 * States a single lookup passes through. HIT, STORE and DISCARD are terminal.
 */
public enum ResolutionState {

    LOOKUP,
    HIT,
    MISS,
    GENERATE,
    VALIDATE,
    STORE,
    DISCARD;

    public Set<ResolutionState> successors() {
        return switch (this) {
            case LOOKUP -> EnumSet.of(HIT, MISS);
            case MISS -> EnumSet.of(GENERATE, HIT);
            case GENERATE -> EnumSet.of(VALIDATE, DISCARD);
            case VALIDATE -> EnumSet.of(STORE, DISCARD);
            case HIT, STORE, DISCARD -> EnumSet.noneOf(ResolutionState.class);
        };
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
