package com.runway.executor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Joins two signals that may arrive in either order.
 *
 * <p>The timeout window opens when the first signal arrives, not when the join is
 * created. The wait for the first signal is unbounded: an interactive process runs
 * for as long as the user works in it. Only the wait for the second signal is
 * bounded. A signal that completes exceptionally counts as arrived.
 */
public final class CompletionJoin {

    private CompletionJoin() {}

    public static CompletableFuture<JoinOutcome> awaitBoth(CompletableFuture<?> first,
                                                           CompletableFuture<?> second,
                                                           Duration timeout) {
        return CompletableFuture.anyOf(first, second)
                .handle((value, error) -> null)
                .thenCompose(ignored -> CompletableFuture.allOf(first, second)
                        .handle((value, error) -> JoinOutcome.BOTH_ARRIVED)
                        .completeOnTimeout(JoinOutcome.TIMED_OUT, timeout.toMillis(), TimeUnit.MILLISECONDS));
    }
}
