package com.mtsa.findings.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Records the states of one lookup and rejects transitions the state machine does not allow.
 */
class ResolutionTrace {

    private final List<ResolutionState> states = new ArrayList<>();

    ResolutionTrace() {
        states.add(ResolutionState.LOOKUP);
    }

    void enter(ResolutionState next) {
        ResolutionState current = current();
        if (!current.successors().contains(next)) {
            throw new IllegalStateException("Illegal resolution transition " + current + " -> " + next);
        }
        states.add(next);
    }

    ResolutionState current() {
        return states.get(states.size() - 1);
    }

    List<ResolutionState> states() {
        return List.copyOf(states);
    }
}
