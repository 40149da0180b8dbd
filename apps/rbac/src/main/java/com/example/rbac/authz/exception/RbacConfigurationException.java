package com.example.rbac.authz.exception;

import java.util.List;

/**
 * Invalid role, permission or predicate configuration detected at startup.
 *
 * <p>Never thrown from request-time checks; those deny instead.
 */
public class RbacConfigurationException extends RuntimeException {

    private final List<String> problems;

    public RbacConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public RbacConfigurationException(String summary, List<String> problems) {
        super(summary + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
