package com.aiprofessor.simulation.domain.error;

/** Raised when the tenant cannot be determined or the student is inactive. */
public class SimulationBadRequestException extends SimulationException {

    public SimulationBadRequestException(String messageKey, Object... arguments) {
        super(messageKey, arguments);
    }
}
