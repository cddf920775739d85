/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Configuration records, read from YAML by {@link io.promfed.proxy.config.ConfigParser}.
 *
 * <p>Every record applies its defaults in its compact constructor, so a record built in code
 * and one read from a document with the key left out are equal. Checks spanning several settings
 * are made by {@code validate()}, which reports problems as a checked
 * {@link io.promfed.proxy.config.ConfigException}.</p>
 */

@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.promfed.proxy.config;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
