package com.whereq.kiln.exception;

import com.whereq.kiln.model.BuildPhase;

/**
 * A lifecycle phase whose unit of work did not fully succeed
 */
public class PhaseFailedException extends RuntimeException {

    private final BuildPhase phase;

    public PhaseFailedException(BuildPhase phase, String diagnostic) {
        super("Phase " + phase + " failed: " + diagnostic);
        this.phase = phase;
    }

    public BuildPhase getPhase() {
        return phase;
    }
}
