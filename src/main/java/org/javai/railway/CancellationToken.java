package org.javai.railway;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A cooperative cancellation signal.
 *
 * <p>The token is only ever polled: retry loops and async continuations check it at their
 * suspension points. Cancelling does not interrupt anything already running and does not
 * undo a result already produced.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CancellationToken token = CancellationToken.create();
 * CompletableFuture<Result<Order>> pending = AsyncRetrier.builder().build()
 *     .execute("FetchOrder", token, () -> client.fetchOrder(id));
 *
 * // later, from any thread
 * token.cancel();
 * }</pre>
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final CompletableFuture<Void> signal = new CompletableFuture<>();
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Creates a token that can be cancelled.
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Returns the shared token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Requests cancellation. Idempotent.
     *
     * @throws UnsupportedOperationException if called on {@link #none()}
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        signal.complete(null);
    }

    public boolean isCancellationRequested() {
        return signal.isDone();
    }

    /**
     * Returns a stage that completes when cancellation is requested. The stage of
     * {@link #none()} never completes.
     */
    public CompletionStage<Void> whenCancelled() {
        return signal.minimalCompletionStage();
    }

    /**
     * Throws if cancellation has been requested.
     *
     * @throws CancellationException if cancellation has been requested
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Cancellation requested");
        }
    }

    /**
     * Waits up to {@code timeout} for cancellation to be requested.
     *
     * <p>An interrupt while waiting counts as cancellation; the interrupt flag is restored.
     *
     * @param timeout how long to wait
     * @return true if cancellation was requested before the timeout elapsed
     */
    public boolean awaitCancellation(Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancellationRequested();
        }
        if (!cancellable) {
            pause(timeout);
            return Thread.currentThread().isInterrupted();
        }
        try {
            signal.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Cancellation signal failed", e.getCause());
        }
    }

    private static void pause(Duration timeout) {
        try {
            Thread.sleep(timeout.toMillis(), (int) (timeout.toNanosPart() % 1_000_000));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
