package com.aiprofessor.security;

/**
 * The identity a credential was issued to.
 *
 * @param userId            subject of the token
 * @param email             contact email, nullable
 * @param role              platform role
 * @param tenantId          school the user belongs to; null only for {@link Role#SUPER_ADMIN}
 * @param preferredLanguage language for user-facing messages
 */
public record AuthenticatedUser(
        String userId,
        String email,
        Role role,
        String tenantId,
        Language preferredLanguage
) {

    public AuthenticatedUser {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        if (preferredLanguage == null) {
            preferredLanguage = Language.DEFAULT;
        }
    }

    public boolean hasTenant() {
        return tenantId != null && !tenantId.isBlank();
    }
}
