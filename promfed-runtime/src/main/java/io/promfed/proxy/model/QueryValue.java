/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.model;

/**
 * Result of a query against a backend.
 *
 * <pre>
 *   Scalar       single value at one instant
 *   StringValue  single string at one instant
 *   Vector       one sample per series at one instant
 *   Matrix       a run of samples per series over a range
 * </pre>
 */
public sealed interface QueryValue permits Scalar, StringValue, Vector, Matrix {

    ValueType type();

    enum ValueType {
        SCALAR("scalar"),
        STRING("string"),
        VECTOR("vector"),
        MATRIX("matrix");

        private final String wireName;

        ValueType(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static ValueType forWireName(String wireName) {
            for (ValueType type : values()) {
                if (type.wireName.equals(wireName)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("unknown result type '" + wireName + "'");
        }
    }
}
