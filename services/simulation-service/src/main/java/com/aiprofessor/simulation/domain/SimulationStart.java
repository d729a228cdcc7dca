package com.aiprofessor.simulation.domain;

import com.aiprofessor.security.TokenPair;

/** Outcome of starting a simulation: the new session, the student and the scoped credentials. */
public record SimulationStart(
        SimulationSession session, StudentRecord student, TenantRecord tenant, TokenPair tokens) {}
