/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.model;

public record Scalar(double value, long timestamp) implements QueryValue {
    @Override
    public ValueType type() {
        return ValueType.SCALAR;
    }
}
