/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.client;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Base of the failures raised while answering a query.
 */
public class BackendCallException extends RuntimeException {

    public BackendCallException(String message) {
        super(message);
    }

    public BackendCallException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
