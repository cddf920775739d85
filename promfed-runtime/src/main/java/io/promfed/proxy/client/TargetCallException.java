/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.client;

import java.util.Objects;

/**
 * A call to one backend target failed. The cause is the underlying failure.
 */
public class TargetCallException extends BackendCallException {

    private final String target;
    private final String call;

    public TargetCallException(String target, String call, Throwable cause) {
        super("error calling " + call + " on " + target + ": " + cause.getMessage(), Objects.requireNonNull(cause));
        this.target = Objects.requireNonNull(target);
        this.call = Objects.requireNonNull(call);
    }

    /**
     * @return address of the failing target
     */
    public String target() {
        return target;
    }

    /**
     * @return name of the failing operation
     */
    public String call() {
        return call;
    }
}
