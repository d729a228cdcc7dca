package com.aiprofessor.simulation.domain.error;

/** Raised on an illegal session transition, such as ending an ENDED session. */
public class InvalidSimulationStateException extends SimulationException {

    public InvalidSimulationStateException(String messageKey, Object... arguments) {
        super(messageKey, arguments);
    }
}
