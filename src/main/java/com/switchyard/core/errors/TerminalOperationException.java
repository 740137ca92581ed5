package com.switchyard.core.errors;

public class TerminalOperationException extends SwitchyardException {

    public TerminalOperationException(String message) {
        super(ErrorKind.TERMINAL_OPERATION_FAILED, "Terminal operation failed: " + message);
    }

    public TerminalOperationException(String message, Throwable cause) {
        super(ErrorKind.TERMINAL_OPERATION_FAILED, "Terminal operation failed: " + message, cause);
    }
}
