package io.malicki.transferpipeline.api;

import io.malicki.transferpipeline.domain.user.UserRole;
import io.malicki.transferpipeline.exception.AdminAccessDeniedException;
import io.malicki.transferpipeline.exception.MissingUserIdException;

/**
 * Caller identity as forwarded by the authentication layer in front of this
 * service. Values are trusted once present.
 */
final class CallerHeaders {

    static final String USER_ID = "X-User-Id";
    static final String USER_ROLE = "X-User-Role";

    private CallerHeaders() {
    }

    static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new MissingUserIdException("Missing " + USER_ID + " header");
        }
        return userId.trim();
    }

    static String requireAdmin(String userId, String role) {
        String caller = requireUserId(userId);
        if (role == null || !UserRole.ADMIN.name().equalsIgnoreCase(role.trim())) {
            throw new AdminAccessDeniedException(caller);
        }
        return caller;
    }
}
