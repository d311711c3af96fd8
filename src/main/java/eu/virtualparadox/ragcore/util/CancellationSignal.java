package eu.virtualparadox.ragcore.util;

import eu.virtualparadox.ragcore.exception.OperationCancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned abort signal shared by the chunking, embedding and search operations.
 * <p>
 * A signal fires either when {@link #cancel()} is called or when its optional deadline has
 * passed. Operations poll {@link #throwIfCancelled()} at their suspension points and may
 * register listeners through {@link #onCancel(Runnable)} to abort in-flight work.
 * Deadlines are only observed by polling; components that must react to an expiring deadline
 * while suspended schedule {@link #cancel()} themselves (see {@link #remaining()}).
 * </p>
 * <p>Instances are thread-safe. A signal is meant for one logical call and is not reusable.</p>
 */
public final class CancellationSignal {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private CancellationSignal(final Clock clock, final Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /**
     * @return a signal that only fires on an explicit {@link #cancel()}
     */
    public static CancellationSignal create() {
        return new CancellationSignal(Clock.systemUTC(), null);
    }

    /**
     * @return a fresh signal nobody holds a reference to cancel; used by the convenience overloads
     */
    public static CancellationSignal none() {
        return create();
    }

    /**
     * @param timeout time budget from now, must be non-negative
     * @return a signal that fires once {@code timeout} has elapsed or on an explicit cancel
     */
    public static CancellationSignal withTimeout(final Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    static CancellationSignal withTimeout(final Duration timeout, final Clock clock) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        return new CancellationSignal(clock, clock.instant().plus(timeout));
    }

    /**
     * Fires the signal and runs all registered listeners once. Further calls are no-ops.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (final Runnable listener : listeners) {
                listener.run();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    /**
     * @throws OperationCancelledException if the signal has fired or the deadline passed
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException(deadlinePassed() ? "Deadline exceeded" : "Operation cancelled");
        }
    }

    /**
     * Time left until the deadline, empty when the signal has none.
     *
     * @return remaining budget, never negative
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        final Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Registers a listener run on {@link #cancel()}. If the signal was already cancelled the
     * listener runs immediately on the calling thread.
     *
     * @param listener action aborting in-flight work
     * @return handle removing the listener again once the work completed
     */
    public Runnable onCancel(final Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    private boolean deadlinePassed() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}
