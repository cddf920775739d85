/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.client;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A backend answered, but with an error or with a response that could not be understood.
 */
public class BackendResponseException extends BackendCallException {

    private final int statusCode;
    private final @Nullable String errorType;

    public BackendResponseException(int statusCode, @Nullable String errorType, String message) {
        super(message);
        this.statusCode = statusCode;
        this.errorType = errorType;
    }

    public BackendResponseException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorType = null;
    }

    /**
     * @return HTTP status code of the response
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * @return the error type reported by the backend ({@code bad_data}, {@code timeout}, ...), if any
     */
    @Nullable
    public String errorType() {
        return errorType;
    }
}
