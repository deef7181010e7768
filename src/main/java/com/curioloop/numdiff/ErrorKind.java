/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * Categories of differentiation errors.
 */
public enum ErrorKind {

    /** The target function failed or returned a malformed value */
    EVALUATION(-1, "Function evaluation failed"),

    /** The request was rejected before any function evaluation */
    CONFIGURATION(-2, "Invalid configuration");

    private final int code;
    private final String message;

    ErrorKind(int code, String message) {
        this.code = code;
        this.message = message;
    }

    /**
     * Gets the numeric error code.
     * @return Error code
     */
    public int getCode() {
        return code;
    }

    /**
     * Gets the error description.
     * @return Description
     */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return name() + "(" + code + "): " + message;
    }
}
