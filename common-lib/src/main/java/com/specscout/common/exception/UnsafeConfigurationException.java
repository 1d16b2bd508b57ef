package com.specscout.common.exception;

/**
 * Configuration combines settings that could change test sources or fail a build without
 * review. Raised before any profile is analyzed; the only fatal error of an analysis run.
 */
public class UnsafeConfigurationException extends RuntimeException {

    public UnsafeConfigurationException(String message) {
        super(message);
    }
}
