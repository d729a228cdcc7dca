package com.aiprofessor.simulation.domain;

/**
 * Where a request came from, kept for audit.
 *
 * @param ipAddress client address, nullable
 * @param userAgent client user agent, nullable
 */
public record RequestOrigin(String ipAddress, String userAgent) {

    public static RequestOrigin unknown() {
        return new RequestOrigin(null, null);
    }
}
