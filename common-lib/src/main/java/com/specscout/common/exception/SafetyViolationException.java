package com.specscout.common.exception;

import java.util.List;

/** A monitored spec file changed while it was being analyzed. */
public class SafetyViolationException extends RuntimeException {
    private final List<String> modifiedFiles;

    public SafetyViolationException(List<String> modifiedFiles) {
        super("Spec files modified during analysis: " + String.join(", ", modifiedFiles));
        this.modifiedFiles = List.copyOf(modifiedFiles);
    }

    public List<String> getModifiedFiles() {
        return modifiedFiles;
    }
}
