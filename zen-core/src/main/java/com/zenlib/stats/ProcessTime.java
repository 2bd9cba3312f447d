package com.zenlib.stats;

import com.zenlib.util.Format;
import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Wall and CPU time consumed by the current thread between two snapshots.
 * <p>
 * CPU time is empty when the JVM does not support measuring it for the current thread.
 */
public record ProcessTime(Duration wall, Optional<Duration> cpu) {

  private static final ThreadMXBean THREADS = ManagementFactory.getThreadMXBean();

  /** Takes a snapshot of wall time and the current thread's CPU time. */
  public static ProcessTime now() {
    Optional<Duration> cpu = Optional.empty();
    if (THREADS.isCurrentThreadCpuTimeSupported()) {
      long nanos = THREADS.getCurrentThreadCpuTime();
      if (nanos >= 0) {
        cpu = Optional.of(Duration.ofNanos(nanos));
      }
    }
    return new ProcessTime(Duration.ofNanos(System.nanoTime()), cpu);
  }

  /** Returns the amount of time elapsed between {@code other} and {@code this}. */
  ProcessTime minus(ProcessTime other) {
    return new ProcessTime(
      wall.minus(other.wall),
      cpu.flatMap(thisCpu -> other.cpu.map(thisCpu::minus))
    );
  }

  public String toString(Locale locale) {
    Format format = Format.forLocale(locale);
    return format.duration(wall) + " cpu:" + cpu.map(format::duration).orElse("-");
  }

  @Override
  public String toString() {
    return toString(Format.DEFAULT_LOCALE);
  }
}
