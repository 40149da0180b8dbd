package com.example.rbac.authz.model;

/**
 * Outcome of resolving one permission for one subject.
 *
 * @param granted    whether access is allowed
 * @param reason     which step of the resolution produced the outcome
 * @param permission the permission that was checked, {@code null} if it could not be determined
 * @param detail     human-readable explanation, for logs and diagnostics only
 */
public record AccessDecision(
        boolean granted,
        Reason reason,
        Permission permission,
        String detail
) {
    public enum Reason {
        /**
         * Permission present in the subject's explicit overrides.
         */
        EXPLICIT_OVERRIDE,
        /**
         * Permission in the accumulated role set and no predicate registered.
         */
        ROLE_GRANT,
        /**
         * Permission in the accumulated role set and the predicate passed.
         */
        PREDICATE_GRANT,
        /**
         * Permission in the accumulated role set but the predicate rejected it.
         */
        PREDICATE_DENY,
        /**
         * Predicate threw; treated as deny.
         */
        PREDICATE_ERROR,
        /**
         * Permission absent from the accumulated role set.
         */
        NOT_GRANTED,
        /**
         * Subject or permission missing or malformed.
         */
        INVALID_REQUEST
    }

    public static AccessDecision grant(Reason reason, Permission permission, String detail) {
        return new AccessDecision(true, reason, permission, detail);
    }

    public static AccessDecision deny(Reason reason, Permission permission, String detail) {
        return new AccessDecision(false, reason, permission, detail);
    }

    public boolean isGranted() {
        return granted;
    }

    public boolean isDenied() {
        return !granted;
    }
}
