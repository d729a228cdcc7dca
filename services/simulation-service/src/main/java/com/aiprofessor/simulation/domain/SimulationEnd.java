package com.aiprofessor.simulation.domain;

import com.aiprofessor.security.TokenPair;

/**
 * Outcome of ending a simulation. When no session was found {@code session} is null and {@code
 * tokens} is empty.
 */
public record SimulationEnd(SimulationSession session, TokenPair tokens) {

    public static SimulationEnd nothingToEnd() {
        return new SimulationEnd(null, TokenPair.empty());
    }

    public boolean ended() {
        return session != null;
    }
}
