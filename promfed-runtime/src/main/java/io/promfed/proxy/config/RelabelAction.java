/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.config;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a relabel step does with the labels of a target.
 */
public enum RelabelAction {
    /** Writes the expanded replacement to the target label when the regex matches. */
    REPLACE,
    /** Drops the target unless the regex matches. */
    KEEP,
    /** Drops the target when the regex matches. */
    DROP,
    /** Writes the hash of the source value modulo {@code modulus} to the target label. */
    HASHMOD,
    /** Copies labels whose name matches the regex to the name given by the replacement. */
    LABELMAP,
    /** Removes labels whose name matches the regex. */
    LABELDROP,
    /** Removes labels whose name does not match the regex. */
    LABELKEEP;

    @JsonValue
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RelabelAction forConfigName(String name) {
        for (RelabelAction action : values()) {
            if (action.configName().equalsIgnoreCase(name)) {
                return action;
            }
        }
        throw new IllegalArgumentException("unknown relabel action '" + name + "'");
    }
}
