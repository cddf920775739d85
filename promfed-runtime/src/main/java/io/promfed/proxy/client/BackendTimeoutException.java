/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.client;

/**
 * A backend did not answer within the allowed time.
 */
public class BackendTimeoutException extends BackendCallException {

    public BackendTimeoutException(String message) {
        super(message);
    }
}
