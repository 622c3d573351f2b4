package com.mlops.cleanup.config;

/**
 * Configuration could not be read or does not describe a valid baseline.
 * The run aborts before any cluster query when this is thrown.
 */
public class BaselineConfigException extends Exception {

    public BaselineConfigException(String message) {
        super(message);
    }

    public BaselineConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
