/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples.task;

/** One runnable example program, selected by {@code resp.example.task}. */
public interface ExampleTask {

  /** Value of {@code resp.example.task} that selects this task. */
  String name();

  /**
   * Runs until {@code max-iterations} is reached (or forever when it is 0).
   *
   * @throws InterruptedException when the running thread is interrupted while waiting
   */
  void run() throws InterruptedException;
}
