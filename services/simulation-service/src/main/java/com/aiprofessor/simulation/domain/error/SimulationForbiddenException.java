package com.aiprofessor.simulation.domain.error;

/** Raised when the caller's role may not perform the operation. */
public class SimulationForbiddenException extends SimulationException {

    public SimulationForbiddenException(String messageKey, Object... arguments) {
        super(messageKey, arguments);
    }
}
