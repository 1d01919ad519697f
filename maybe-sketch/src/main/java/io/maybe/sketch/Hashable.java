package io.maybe.sketch;

/**
 * A value that can be fed to {@link BloomFilter}, {@link CountMinSketch} or {@link HyperLogLog}.
 *
 * <p>Implementations must return the same bytes for values that should be counted as the same element,
 * every hash function in this package only looks at {@link #bytes()}.
 *
 * @see Hashables
 */
public interface Hashable
{
  byte[] bytes();
}
