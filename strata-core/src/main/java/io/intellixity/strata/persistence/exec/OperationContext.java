package io.intellixity.strata.persistence.exec;

import io.intellixity.strata.persistence.error.OperationCancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline carrier passed as the first argument of every data operation.
 * <p>
 * Contexts form a tree: a child inherits the earlier of its own and its parent's deadline and is
 * cancelled when the parent is. {@link #background()} is the root; it never expires and cannot be
 * cancelled.
 */
public final class OperationContext implements AutoCloseable {
  private static final OperationContext BACKGROUND = new OperationContext(null, Clock.systemUTC(), null);

  private final Instant deadline;
  private final Clock clock;
  private final OperationContext parent;
  private final Set<OperationContext> children = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

  private OperationContext(Instant deadline, Clock clock, OperationContext parent) {
    this.deadline = deadline;
    this.clock = clock;
    this.parent = parent;
  }

  public static OperationContext background() { return BACKGROUND; }

  public OperationContext withTimeout(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    return withDeadline(clock.instant().plus(timeout));
  }

  public OperationContext withDeadline(Instant at) {
    Objects.requireNonNull(at, "deadline");
    Instant effective = (deadline != null && deadline.isBefore(at)) ? deadline : at;
    return child(effective, clock);
  }

  public OperationContext withCancel() {
    return child(deadline, clock);
  }

  /** Same deadline and cancellation as this context, measured against another clock. */
  public OperationContext withClock(Clock other) {
    return child(deadline, Objects.requireNonNull(other, "clock"));
  }

  private OperationContext child(Instant childDeadline, Clock childClock) {
    if (this == BACKGROUND) return new OperationContext(childDeadline, childClock, null);
    children.removeIf(OperationContext::isExpired);
    OperationContext c = new OperationContext(childDeadline, childClock, this);
    children.add(c);
    if (cancelled.get()) c.cancel();
    return c;
  }

  /** Cancels this context and every context derived from it, and detaches it from its parent. Idempotent. */
  public void cancel() {
    if (this == BACKGROUND) throw new IllegalStateException("background context cannot be cancelled");
    if (!cancelled.compareAndSet(false, true)) return;
    if (parent != null) parent.children.remove(this);
    for (Runnable r : listeners) r.run();
    listeners.clear();
    for (OperationContext c : children) c.cancel();
    children.clear();
  }

  /** Ends the scope of this context: same as {@link #cancel()}, but a no-op on the background context. */
  @Override
  public void close() {
    if (this != BACKGROUND) cancel();
  }

  /** Children still tracked by this context. */
  int liveChildren() { return children.size(); }

  public boolean isCancelled() { return cancelled.get(); }

  public boolean isExpired() {
    return deadline != null && !clock.instant().isBefore(deadline);
  }

  public boolean isDone() { return isCancelled() || isExpired(); }

  public Optional<Instant> deadline() { return Optional.ofNullable(deadline); }

  /** Time left before the deadline, never negative; empty when there is no deadline. */
  public Optional<Duration> remaining() {
    if (deadline == null) return Optional.empty();
    Duration d = Duration.between(clock.instant(), deadline);
    return Optional.of(d.isNegative() ? Duration.ZERO : d);
  }

  public void throwIfDone() {
    if (isCancelled()) throw new OperationCancelledException("operation cancelled");
    if (isExpired()) throw new OperationCancelledException("deadline exceeded");
  }

  /**
   * Registers a callback run once on cancellation; it runs immediately if already cancelled.
   * Closing the returned registration detaches it.
   */
  public Registration onCancel(Runnable listener) {
    Objects.requireNonNull(listener, "listener");
    if (this == BACKGROUND) return () -> {};
    Runnable once = runOnce(listener);
    listeners.add(once);
    if (cancelled.get()) once.run();
    return () -> listeners.remove(once);
  }

  /** Wraps {@code r} so that only the first call reaches it. */
  static Runnable runOnce(Runnable r) {
    AtomicBoolean ran = new AtomicBoolean();
    return () -> {
      if (ran.compareAndSet(false, true)) r.run();
    };
  }

  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override void close();
  }
}
