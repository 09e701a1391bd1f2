package com.onthegomap.trailcover.worker;

/**
 * A task that can throw checked exceptions.
 */
@FunctionalInterface
public interface RunnableThatThrows {

  @SuppressWarnings("java:S112")
  void run() throws Exception;
}
