/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * The client stack of a server group.
 *
 * <pre>
 *   ErrorSuppressingClient          optional, answers with partial data
 *     MergeClient                   fans out to every target, fails over between replicas
 *       LabelInjectingClient        one per target, adds the target labels
 *         RemoteReadClient          optional, raw data over remote read
 *           DirectQueryClient       the Prometheus HTTP API
 * </pre>
 */

@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.promfed.proxy.internal.client;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
