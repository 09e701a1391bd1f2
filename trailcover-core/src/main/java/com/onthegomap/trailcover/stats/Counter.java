package com.onthegomap.trailcover.stats;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * A {@code long} value that only goes up, read back by the stats summary.
 * <p>
 * Incrementing an {@link AtomicLong} from many worker threads at once contends on one cache line, so
 * {@link MultiThreadCounter} hands out a counter to each thread and adds up the total on read.
 */
public interface Counter {

  default void inc() {
    incBy(1);
  }

  void incBy(long value);

  /** A counter that lets clients get the current value. */
  interface Readable extends Counter, LongSupplier {

    long get();

    @Override
    default long getAsLong() {
      return get();
    }
  }

  /** Returns a counter that is optimized for updates from a single thread, but safe from any thread. */
  static Readable newSingleThreadCounter() {
    return new SingleThreadCounter();
  }

  /** Returns a counter optimized for updates from multiple threads and infrequent reads. */
  static MultiThreadCounter newMultiThreadCounter() {
    return new MultiThreadCounter();
  }

  class SingleThreadCounter implements Readable {

    private SingleThreadCounter() {}

    private final AtomicLong counter = new AtomicLong(0);

    @Override
    public void incBy(long value) {
      counter.addAndGet(value);
    }

    @Override
    public long get() {
      return counter.get();
    }
  }

  /**
   * Counter updated from worker threads and read once a stage finishes.
   * <p>
   * Workers should grab {@link #counterForThread()} once instead of calling {@link #inc()} in a hot loop.
   */
  class MultiThreadCounter implements Readable {

    private MultiThreadCounter() {}

    private final List<SingleThreadCounter> all = new CopyOnWriteArrayList<>();
    private final ThreadLocal<SingleThreadCounter> thread = ThreadLocal.withInitial(() -> {
      SingleThreadCounter counter = new SingleThreadCounter();
      all.add(counter);
      return counter;
    });

    @Override
    public void incBy(long value) {
      thread.get().incBy(value);
    }

    public Counter counterForThread() {
      return thread.get();
    }

    @Override
    public long get() {
      return all.stream().mapToLong(SingleThreadCounter::get).sum();
    }
  }
}
