package com.aiprofessor.simulation.domain.error;

/** Raised when the tenant or the student does not exist. */
public class SimulationNotFoundException extends SimulationException {

    public SimulationNotFoundException(String messageKey, Object... arguments) {
        super(messageKey, arguments);
    }
}
