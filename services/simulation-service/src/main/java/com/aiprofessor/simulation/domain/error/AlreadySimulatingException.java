package com.aiprofessor.simulation.domain.error;

/** Raised when a simulation credential is used to start another simulation. */
public class AlreadySimulatingException extends SimulationException {

    public AlreadySimulatingException(String messageKey, Object... arguments) {
        super(messageKey, arguments);
    }
}
