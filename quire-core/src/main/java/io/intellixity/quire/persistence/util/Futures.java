package io.intellixity.quire.persistence.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class Futures {
  private Futures() {}

  /**
   * Waits for every future, then returns their values in order.\n
   *
   * All futures run to completion even when one fails; the first failure (in list order) is then
   * rethrown as the original exception.
   */
  public static <T> List<T> joinAll(List<CompletableFuture<T>> futures) {
    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    } catch (CompletionException e) {
      for (CompletableFuture<T> f : futures) {
        if (f.isCompletedExceptionally()) join(f);
      }
      throw rethrow(e.getCause());
    }
    List<T> out = new ArrayList<>(futures.size());
    for (CompletableFuture<T> f : futures) out.add(f.join());
    return out;
  }

  /** {@link CompletableFuture#join()} without the {@link CompletionException} wrapper. */
  public static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      throw rethrow(e.getCause());
    }
  }

  private static RuntimeException rethrow(Throwable cause) {
    if (cause instanceof CompletionException || cause instanceof ExecutionException) {
      cause = (cause.getCause() == null) ? cause : cause.getCause();
    }
    if (cause instanceof RuntimeException re) return re;
    if (cause instanceof Error e) throw e;
    return new IllegalStateException(cause);
  }
}
