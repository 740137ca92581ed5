package com.switchyard.core.errors;

public class DatabaseException extends SwitchyardException {

    public DatabaseException(String message, Throwable cause) {
        super(ErrorKind.DATABASE_ERROR, "Database error: " + message, cause);
    }
}
