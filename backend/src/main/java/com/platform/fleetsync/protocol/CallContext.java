package com.platform.fleetsync.protocol;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellable, deadline-bound context for device calls.
 * 
 * A child's deadline is min(parent deadline, now + timeout). Cancelling a
 * context cancels every child derived from it. Children detach from their
 * parent on {@link #close()}.
 */
public final class CallContext implements AutoCloseable {
    
    private final CallContext parent;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> cancelListeners = new CopyOnWriteArrayList<>();
    private final Runnable detachFromParent;
    
    private CallContext(CallContext parent, Instant deadline) {
        this.parent = parent;
        this.deadline = deadline;
        this.detachFromParent = parent != null ? parent.onCancel(this::cancel) : () -> { };
    }
    
    /**
     * A context with no deadline. Cancelled only explicitly.
     */
    public static CallContext root() {
        return new CallContext(null, null);
    }
    
    /**
     * Derive a child bound by the given timeout and by this context's deadline.
     */
    public CallContext withTimeout(Duration timeout) {
        Instant candidate = Instant.now().plus(timeout);
        Instant childDeadline = deadline == null || candidate.isBefore(deadline) ? candidate : deadline;
        return new CallContext(this, childDeadline);
    }
    
    /**
     * Derive a child sharing this context's deadline, for grouping calls that can be cancelled together.
     */
    public CallContext child() {
        return new CallContext(this, deadline);
    }
    
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable listener : cancelListeners) {
                listener.run();
            }
            cancelListeners.clear();
        }
    }
    
    public boolean isCancelled() {
        return cancelled.get();
    }
    
    public boolean isExpired() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }
    
    /**
     * Time left until the deadline, never negative. A context without deadline reports a very long duration.
     */
    public Duration remaining() {
        if (deadline == null) {
            return Duration.ofDays(1);
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
    
    public Instant getDeadline() {
        return deadline;
    }
    
    /**
     * Register a listener run once on cancellation. Runs immediately if already cancelled.
     *
     * @return a handle that unregisters the listener
     */
    public Runnable onCancel(Runnable listener) {
        if (isCancelled()) {
            listener.run();
            return () -> { };
        }
        cancelListeners.add(listener);
        if (isCancelled() && cancelListeners.remove(listener)) {
            listener.run();
        }
        return () -> cancelListeners.remove(listener);
    }
    
    /**
     * Detach from the parent so a long-lived root does not accumulate finished children.
     */
    @Override
    public void close() {
        if (parent != null) {
            detachFromParent.run();
        }
    }
}
