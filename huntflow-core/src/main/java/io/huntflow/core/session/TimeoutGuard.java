package io.huntflow.core.session;

import io.huntflow.core.error.HuntflowException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs blocking collaborator calls (connector fetches, analytics runs) with a deadline. A single
 * worker thread per session keeps calls sequential.
 */
public final class TimeoutGuard implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(TimeoutGuard.class);

  private final String name;
  private ExecutorService executor;

  public TimeoutGuard(String name) {
    this.name = name;
  }

  /**
   * Runs a task and waits at most {@code timeout} for it.
   *
   * @param description what is being called, for messages
   * @param timeout deadline; null or non-positive waits without limit
   * @param task the blocking call
   * @param failure builds the exception for timeouts, interrupts and non-huntflow failures
   * @return the task's result
   * @throws HuntflowException the task's own huntflow exception, or one built by {@code failure}
   */
  public <T> T call(
      String description,
      Duration timeout,
      Callable<T> task,
      BiFunction<String, Throwable, ? extends HuntflowException> failure)
      throws HuntflowException {
    Future<T> future = executor().submit(task);
    try {
      if (timeout == null || timeout.isZero() || timeout.isNegative()) {
        return future.get();
      }
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      LOG.warn("{} timed out after {} ms", description, timeout.toMillis());
      throw failure.apply(description + " timed out after " + timeout.toMillis() + " ms", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw failure.apply(description + " was interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof HuntflowException he) throw he;
      throw failure.apply(description + " failed: " + cause.getMessage(), cause);
    }
  }

  private synchronized ExecutorService executor() {
    if (executor == null) {
      executor =
          Executors.newSingleThreadExecutor(
              r -> {
                Thread t = new Thread(r, "huntflow-" + name + "-calls");
                t.setDaemon(true);
                return t;
              });
    }
    return executor;
  }

  @Override
  public synchronized void close() {
    if (executor != null) {
      executor.shutdownNow();
      executor = null;
    }
  }
}
