package com.aiprofessor.simulation.domain.error;

import java.util.Arrays;

/**
 * Base class of the errors raised by the simulation domain. The message is a key of the service
 * message bundle, resolved in the caller's language by the web layer.
 */
public abstract class SimulationException extends RuntimeException {

    private final String messageKey;
    private final transient Object[] arguments;

    protected SimulationException(String messageKey, Object... arguments) {
        super(messageKey);
        this.messageKey = messageKey;
        this.arguments = arguments == null ? new Object[0] : arguments.clone();
    }

    public String messageKey() {
        return messageKey;
    }

    public Object[] arguments() {
        return arguments.clone();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + messageKey + Arrays.toString(arguments) + "]";
    }
}
