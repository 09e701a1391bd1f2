package com.onthegomap.trailcover.stats;

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.ThreadInfo;
import java.lang.management.ThreadMXBean;
import java.time.Duration;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Runtime information about the JVM used to annotate stage timings.
 */
public class ProcessInfo {

  private ProcessInfo() {}

  /** Returns the CPU time this process has used, or empty if the JVM does not expose it. */
  public static Optional<Duration> getProcessCpuTime() {
    if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean osBean) {
      long nanos = osBean.getProcessCpuTime();
      return nanos < 0 ? Optional.empty() : Optional.of(Duration.ofNanos(nanos));
    }
    return Optional.empty();
  }

  /** Returns the amount of time this JVM has spent in any kind of garbage collection since startup. */
  public static Duration getGcTime() {
    long total = 0;
    for (final GarbageCollectorMXBean gc : ManagementFactory.getGarbageCollectorMXBeans()) {
      total += Math.max(0, gc.getCollectionTime());
    }
    return Duration.ofMillis(total);
  }

  /** Returns the JVM used memory in bytes. */
  public static long getUsedMemoryBytes() {
    Runtime runtime = Runtime.getRuntime();
    return runtime.totalMemory() - runtime.freeMemory();
  }

  /** Returns the maximum amount of memory the JVM will use. */
  public static long getMaxMemoryBytes() {
    return Runtime.getRuntime().maxMemory();
  }

  /** Processor usage statistics for a thread. */
  public record ThreadState(String name, Duration cpuTime, Duration userTime, long id) {

    public static final ThreadState DEFAULT = new ThreadState("", Duration.ZERO, Duration.ZERO, -1);

    private static long zeroIfUnsupported(LongSupplier supplier) {
      try {
        return Math.max(0, supplier.getAsLong());
      } catch (UnsupportedOperationException e) {
        return 0;
      }
    }

    ThreadState(ThreadMXBean threadMXBean, ThreadInfo thread) {
      this(
        thread.getThreadName(),
        Duration.ofNanos(zeroIfUnsupported(() -> threadMXBean.getThreadCpuTime(thread.getThreadId()))),
        Duration.ofNanos(zeroIfUnsupported(() -> threadMXBean.getThreadUserTime(thread.getThreadId()))),
        thread.getThreadId()
      );
    }

    /** Adds up the timers in two {@code ThreadState} instances */
    public ThreadState plus(ThreadState other) {
      return new ThreadState("<multiple threads>", cpuTime.plus(other.cpuTime), userTime.plus(other.userTime), -1);
    }
  }

  /** Returns CPU usage of the calling thread, or {@link ThreadState#DEFAULT} if unavailable. */
  public static ThreadState getCurrentThreadState() {
    ThreadMXBean threadMXBean = ManagementFactory.getThreadMXBean();
    ThreadInfo thread = threadMXBean.getThreadInfo(Thread.currentThread().getId());
    return thread == null ? ThreadState.DEFAULT : new ThreadState(threadMXBean, thread);
  }
}
