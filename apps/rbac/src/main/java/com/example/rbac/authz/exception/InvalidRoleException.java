package com.example.rbac.authz.exception;

public class InvalidRoleException extends RbacConfigurationException {

    private final String value;

    public InvalidRoleException(String value) {
        super("Unknown role: '" + value + "'");
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
