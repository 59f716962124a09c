package uk.gegc.inventra.features.tier.api;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;

import java.util.UUID;

/**
 * Resolves the calling user from the JWT subject.
 */
final class TierSecurityUtils {

    private TierSecurityUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    static UUID currentUserId(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new AccessDeniedException("No authenticated user found");
        }
        String subject = authentication.getName();
        if (subject == null || subject.isBlank()) {
            throw new AccessDeniedException("User ID not found in authentication");
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException e) {
            throw new AccessDeniedException("Invalid user ID format in authentication");
        }
    }
}
