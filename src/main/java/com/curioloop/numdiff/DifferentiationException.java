/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * Base exception for failed derivative requests.
 * <p>
 * An inconsistent direction is not an error: it is reported through
 * {@link DirectionalDerivative#isSuccess()}.
 * </p>
 */
public class DifferentiationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    /**
     * Creates a differentiation exception.
     * @param message Error message
     * @param kind Error kind
     */
    public DifferentiationException(String message, ErrorKind kind) {
        super(message);
        this.kind = kind;
    }

    /**
     * Creates a differentiation exception with cause.
     * @param message Error message
     * @param kind Error kind
     * @param cause Underlying cause
     */
    public DifferentiationException(String message, ErrorKind kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets the error kind.
     * @return Error kind
     */
    public ErrorKind getKind() {
        return kind;
    }
}
