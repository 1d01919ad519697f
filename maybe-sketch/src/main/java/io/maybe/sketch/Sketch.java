package io.maybe.sketch;

/**
 * Common surface of the probabilistic structures in this package.
 *
 * <p>None of the implementations is thread-safe. Callers sharing an instance between threads
 * must serialize access themselves, e.g. by guarding every call with one lock or by confining
 * each instance to a single thread.
 */
public interface Sketch
{
  /**
   * Bytes used by the backing arrays, not counting object headers and fields.
   */
  long memoryFootprint();

  /**
   * A name accepted by {@link Sketches} that builds an empty structure of the same shape.
   */
  String name();
}
