/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.metrics;

/**
 * Outcome of one backend call.
 */
public enum CallStatus {
    SUCCESS("success"),
    ERROR("error");

    private final String tagValue;

    CallStatus(String tagValue) {
        this.tagValue = tagValue;
    }

    public String tagValue() {
        return tagValue;
    }
}
