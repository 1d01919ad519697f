package io.maybe.sketch;

/**
 * Maps a {@link Hashable} to 64 bits. The result is meant to be read as an unsigned integer.
 */
@FunctionalInterface
public interface LongHashFunction<T extends Hashable>
{
  long hash(T value);

  /**
   * Returns a function computing {@code hi + lo * seed} (mod 2^64) from this function's output,
   * where {@code hi} and {@code lo} are its upper and lower 32 bits.
   *
   * <p>Derived functions are only approximately independent of each other. The error bounds of
   * {@link CountMinSketch} assume they are pairwise independent, which is not proven for this scheme.
   */
  default LongHashFunction<T> derive(long seed)
  {
    return value -> {
      final long h = hash(value);
      return (h >>> 32) + (h & 0xFFFFFFFFL) * seed;
    };
  }
}
