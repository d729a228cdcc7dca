package com.aiprofessor.simulation.domain.error;

/** Raised when a simulation credential attempts a write. */
public class SimulationWriteBlockedException extends SimulationException {

    public static final String MESSAGE_KEY = "simulation.write-blocked";

    private final String method;
    private final String path;

    public SimulationWriteBlockedException(String method, String path) {
        super(MESSAGE_KEY);
        this.method = method;
        this.path = path;
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }
}
