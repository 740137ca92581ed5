package com.switchyard.core.errors;

import java.nio.file.Path;

public class IoOperationException extends SwitchyardException {

    private final String operation;
    private final Path path;

    public IoOperationException(String operation, Path path, Throwable cause) {
        super(ErrorKind.IO_ERROR,
                "IO error during '%s' on %s: %s".formatted(operation, path, cause.getMessage()), cause);
        this.operation = operation;
        this.path = path;
    }

    public String operation() {
        return operation;
    }

    public Path path() {
        return path;
    }
}
