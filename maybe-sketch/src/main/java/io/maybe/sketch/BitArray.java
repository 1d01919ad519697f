package io.maybe.sketch;

import com.google.common.base.Preconditions;

/**
 * Fixed size bit array addressed by {@code long} indexes, up to {@link #MAX_BITS} bits.
 */
final class BitArray
{
  static final long MAX_BITS = 1L << 32;

  private final long[] words;
  private final long bitSize;
  private long bitCount;

  BitArray(long bitSize)
  {
    Preconditions.checkArgument(bitSize > 0 && bitSize <= MAX_BITS, "bitSize out of range: %s", bitSize);
    this.words = new long[(int) ((bitSize + Long.SIZE - 1) >>> 6)];
    this.bitSize = bitSize;
  }

  /**
   * @return true if the bit was previously unset
   */
  boolean set(long index)
  {
    final int word = (int) (index >>> 6);
    final long mask = 1L << index; // shift distance is taken mod 64
    if ((words[word] & mask) != 0) {
      return false;
    }
    words[word] |= mask;
    bitCount++;
    return true;
  }

  boolean get(long index)
  {
    return (words[(int) (index >>> 6)] & (1L << index)) != 0;
  }

  long bitSize()
  {
    return bitSize;
  }

  long bitCount()
  {
    return bitCount;
  }

  long memoryFootprint()
  {
    return (long) words.length * Long.BYTES;
  }
}
