/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.model;

/**
 * One point of a series.
 *
 * @param timestamp milliseconds since the epoch
 * @param value sample value
 */
public record SamplePair(long timestamp, double value) {
}
