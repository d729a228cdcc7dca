package com.aiprofessor.simulation.domain;

public enum SimulationMode {

    /** Staff sees the platform exactly as an existing student does. */
    READ_ONLY_IMPERSONATION,

    /** Staff uses a placeholder student account. */
    DUMMY_STUDENT;

    public static final SimulationMode DEFAULT = READ_ONLY_IMPERSONATION;
}
