package com.switchyard.core.errors;

import java.util.List;

/**
 * Reconciliation would conflict, or a partially applied merge needs manual recovery.
 * The conflicting paths are always carried as data.
 */
public class MergeConflictException extends SwitchyardException {

    private final List<String> files;
    private final String detail;

    public MergeConflictException(List<String> files, String detail) {
        super(ErrorKind.MERGE_CONFLICT, "Merge conflict in %d file(s): %s".formatted(files.size(), detail));
        this.files = List.copyOf(files);
        this.detail = detail;
    }

    public List<String> files() {
        return files;
    }

    public String detail() {
        return detail;
    }
}
