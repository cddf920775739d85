/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.group;

/**
 * No client could be built for a discovered target. The target is left out of the group.
 */
public class TargetBuildException extends Exception {

    public TargetBuildException(String message) {
        super(message);
    }

    public TargetBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
