/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.model;

import java.util.List;

public record Matrix(List<SampleStream> streams) implements QueryValue {

    public static final Matrix EMPTY = new Matrix(List.of());

    public Matrix {
        streams = List.copyOf(streams);
    }

    @Override
    public ValueType type() {
        return ValueType.MATRIX;
    }
}
