/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Pooled HTTP transport to the backends, built on Netty.
 *
 * <p>Each server group configuration gets its own {@link io.promfed.proxy.internal.net.NettyHttpTransport}
 * with its own event loop group, TLS context and connection pools. A pipeline of a pooled connection is</p>
 *
 * <pre>
 *   [proxy] → [ssl] → idle → idleCloser → httpCodec → httpDecompressor → httpAggregator → exchange
 * </pre>
 *
 * <p>where {@code exchange} is added for the duration of one request/response exchange.</p>
 */

@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.promfed.proxy.internal.net;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
