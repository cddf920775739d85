/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Supplier;

import io.promfed.proxy.client.MergeException;
import io.promfed.proxy.client.TargetCallException;

/**
 * Helpers for the {@link CompletableFuture} plumbing shared by the client layers.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Strips the {@link CompletionException}/{@link ExecutionException} layers the future machinery adds.
     */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Strips every wrapping layer, including the context added by the client layers,
     * leaving the error the backend (or the transport) originally raised.
     */
    public static Throwable rootCause(Throwable t) {
        Throwable current = unwrap(t);
        while ((current instanceof TargetCallException || current instanceof MergeException) && current.getCause() != null) {
            current = unwrap(current.getCause());
        }
        return current;
    }

    /**
     * Makes cancellation of {@code derived} cancel {@code upstream} too.
     *
     * @return {@code derived}
     */
    public static <T> CompletableFuture<T> propagateCancellation(CompletableFuture<T> derived, Future<?> upstream) {
        derived.whenComplete((result, error) -> {
            if (derived.isCancelled()) {
                upstream.cancel(true);
            }
        });
        return derived;
    }

    /**
     * Invokes an asynchronous operation, turning a synchronously thrown exception into a failed future.
     */
    public static <T> CompletableFuture<T> invoke(Supplier<? extends CompletionStage<T>> operation) {
        try {
            return operation.get().toCompletableFuture();
        }
        catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
