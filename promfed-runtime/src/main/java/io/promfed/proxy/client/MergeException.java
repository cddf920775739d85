/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.client;

import java.util.List;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * More backends failed than a merged call tolerates.
 * <p>
 * The cause is the first failure. The exception also carries whatever the successful
 * backends returned, merged, so that a caller preferring availability can still use it.
 * </p>
 */
public class MergeException extends BackendCallException {

    private final transient List<TargetCallException> failures;
    private final int successes;
    private final transient @Nullable Object partialResult;

    public MergeException(List<TargetCallException> failures, int successes, int tolerance, @Nullable Object partialResult) {
        super(failures.size() + " of " + (failures.size() + successes) + " backends failed (tolerating " + tolerance + "), first error: "
                + failures.get(0).getMessage(), failures.get(0));
        this.failures = List.copyOf(failures);
        this.successes = successes;
        this.partialResult = partialResult;
    }

    public List<TargetCallException> failures() {
        return failures;
    }

    /**
     * @return number of backends that answered successfully
     */
    public int successes() {
        return successes;
    }

    /**
     * @param <T> result type of the failed call
     * @return the merged result of the successful backends, or null if none succeeded
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public <T> T partialResult() {
        return (T) partialResult;
    }
}
