package com.example.rbac.authz.exception;

public class InvalidPermissionException extends RbacConfigurationException {

    private final String value;

    public InvalidPermissionException(String value) {
        super("Malformed permission: '" + value + "' (expected action:resource)");
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
