package com.zenlib.stats;

import java.util.Optional;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Stopwatch for one simplification pass.
 * <p>
 * CPU time is read from the thread that started the timer, so it is only reported when the same thread stops it.
 */
@ThreadSafe
public final class Timer {

  private final Thread owner = Thread.currentThread();
  private final ProcessTime start = ProcessTime.now();
  private ProcessTime end = null;

  private Timer() {}

  public static Timer start() {
    return new Timer();
  }

  /** Records the end of the task. Stopping again moves the end forward. */
  public synchronized Timer stop() {
    ProcessTime now = ProcessTime.now();
    end = Thread.currentThread() == owner ? now : new ProcessTime(now.wall(), Optional.empty());
    return this;
  }

  public synchronized boolean running() {
    return end == null;
  }

  /** Returns the time from start until the end, or until now if the task is still running. */
  public synchronized ProcessTime elapsed() {
    if (end != null) {
      return end.minus(start);
    }
    ProcessTime now = ProcessTime.now();
    if (Thread.currentThread() != owner) {
      now = new ProcessTime(now.wall(), Optional.empty());
    }
    return now.minus(start);
  }

  @Override
  public String toString() {
    return elapsed().toString();
  }
}
