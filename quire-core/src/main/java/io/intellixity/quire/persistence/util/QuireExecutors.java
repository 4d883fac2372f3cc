package io.intellixity.quire.persistence.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Executors for the parallel store calls (offset data+count, batch windows). */
public final class QuireExecutors {
  private QuireExecutors() {}

  /** Fixed pool of daemon threads named {@code <prefix>-<n>}. The caller owns shutdown. */
  public static ExecutorService fixedDaemonPool(String prefix, int threads) {
    if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
    AtomicInteger seq = new AtomicInteger();
    ThreadFactory tf = r -> {
      Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
    return Executors.newFixedThreadPool(threads, tf);
  }
}
