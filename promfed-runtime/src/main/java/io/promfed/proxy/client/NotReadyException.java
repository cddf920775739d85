/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.client;

/**
 * Raised when a query arrives before the first discovery round has produced a set of backends.
 */
public class NotReadyException extends BackendCallException {

    public NotReadyException(String message) {
        super(message);
    }
}
