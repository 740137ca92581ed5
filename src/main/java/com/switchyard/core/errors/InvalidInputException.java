package com.switchyard.core.errors;

public class InvalidInputException extends SwitchyardException {

    private final String field;

    public InvalidInputException(String field, String message) {
        super(ErrorKind.INVALID_INPUT, "Invalid %s: %s".formatted(field, message));
        this.field = field;
    }

    public String field() {
        return field;
    }
}
