/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * Thrown when a request is malformed. Always raised before the target
 * function is called.
 */
public class ConfigurationException extends DifferentiationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a configuration exception.
     * @param message Error message
     */
    public ConfigurationException(String message) {
        super(message, ErrorKind.CONFIGURATION);
    }
}
