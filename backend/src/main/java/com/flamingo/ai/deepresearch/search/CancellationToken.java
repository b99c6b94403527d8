package com.flamingo.ai.deepresearch.search;

import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/** Cooperative cancellation flag shared between a session and its in-flight work. */
@Slf4j
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  public static CancellationToken none() {
    return new CancellationToken();
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** Marks the token cancelled and runs the registered callbacks once. */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      for (Runnable callback : callbacks) {
        try {
          callback.run();
        } catch (RuntimeException e) {
          log.warn("Cancellation callback failed: {}", e.getMessage());
        }
      }
    }
  }

  /**
   * Registers a callback. Runs it immediately if the token is already cancelled.
   *
   * @param callback the action to run on cancellation
   * @return handle that deregisters the callback when closed
   */
  public Registration onCancel(Runnable callback) {
    callbacks.add(callback);
    if (cancelled.get()) {
      callback.run();
    }
    return () -> callbacks.remove(callback);
  }

  @VisibleForTesting
  int callbackCount() {
    return callbacks.size();
  }

  /** Deregisters a cancellation callback. Closing twice is harmless. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {

    @Override
    void close();
  }
}
