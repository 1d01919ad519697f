package io.maybe.sketch;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

public final class Hashes
{
  // first 64 bits of MurmurHash3 x64 128 with seed 0
  private static final HashFunction MURMUR3 = Hashing.murmur3_128();

  private Hashes()
  {
  }

  public static <T extends Hashable> LongHashFunction<T> murmur3()
  {
    return Hashes::murmur3Hash;
  }

  /**
   * Same as {@code Hashes.<T>murmur3().derive(seed)}.
   */
  public static <T extends Hashable> LongHashFunction<T> murmur3(long seed)
  {
    return Hashes.<T>murmur3().derive(seed);
  }

  public static long murmur3Hash(Hashable value)
  {
    return MURMUR3.hashBytes(value.bytes()).asLong();
  }
}
