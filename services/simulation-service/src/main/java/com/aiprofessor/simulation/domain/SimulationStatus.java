package com.aiprofessor.simulation.domain;

/** Lifecycle of a simulation session. ENDED is terminal. */
public enum SimulationStatus {
    ACTIVE,
    ENDED
}
