package com.aiprofessor.database.tenant;

/**
 * Thrown when the connection settings needed to reach a database are missing.
 *
 * <p>This is a deployment error: a process that raises it for tenant traffic should not keep
 * serving that traffic.
 */
public class DatabaseConfigurationException extends RuntimeException {

    public DatabaseConfigurationException(String message) {
        super(message);
    }
}
