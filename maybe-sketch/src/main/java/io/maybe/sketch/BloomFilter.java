package io.maybe.sketch;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.primitives.UnsignedInts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A Bloom filter tests whether a value may have been added to a set, using a fixed amount of memory.
 *
 * <p>{@link #has(Hashable)} never returns false for a value that was added. It may return true for a value
 * that was never added; the probability of such a false positive shrinks with more bits and grows as the
 * filter fills up, see {@link #expectedFpp()}. Values cannot be removed.
 *
 * <p>Two ways of computing bit positions are supported:
 * <ul>
 *   <li>{@link #create(long, int)} hashes each value once with MurmurHash3 and derives {@code numHashes}
 *   positions {@code (lo + i * hi) mod bitSize}, {@code i = 1..numHashes}, from the lower and upper 32 bits
 *   of the hash (double hashing, see Kirsch and Mitzenmacher, "Less Hashing, Same Performance");
 *   <li>{@link #create(long, List)} takes caller supplied functions and sets one bit
 *   {@code hash_i(value) mod bitSize} per function.
 * </ul>
 *
 * <p>Not thread-safe, see {@link Sketch}.
 */
public final class BloomFilter<T extends Hashable> implements Sketch
{
  private static final Logger LOG = LoggerFactory.getLogger(BloomFilter.class);

  private final BitArray bits;
  private final ImmutableList<LongHashFunction<? super T>> hashFunctions;
  private final int numHashes;
  // true: hashFunctions holds one base function used for double hashing
  private final boolean doubleHashing;

  private BloomFilter(
      long bitSize,
      ImmutableList<LongHashFunction<? super T>> hashFunctions,
      int numHashes,
      boolean doubleHashing
  )
  {
    this.bits = new BitArray(bitSize);
    this.hashFunctions = hashFunctions;
    this.numHashes = numHashes;
    this.doubleHashing = doubleHashing;
    LOG.debug("Created bloom filter of {} bits with {} hashes (double hashing: {})", bitSize, numHashes, doubleHashing);
  }

  /**
   * Creates a filter of {@code bitSize} bits setting {@code numHashes} bits per value.
   *
   * @throws InvalidConfigurationException if {@code bitSize} is not in {@code (0, 2^32]} or {@code numHashes < 1}
   */
  public static <T extends Hashable> BloomFilter<T> create(long bitSize, int numHashes)
  {
    checkBitSize(bitSize);
    InvalidConfigurationException.check(numHashes >= 1, "numHashes should be at least 1, got %s", numHashes);
    return new BloomFilter<T>(
        bitSize,
        ImmutableList.<LongHashFunction<? super T>>of(Hashes.<T>murmur3()),
        numHashes,
        true
    );
  }

  /**
   * Creates a filter of {@code bitSize} bits setting one bit per function in {@code hashFunctions}.
   *
   * @throws InvalidConfigurationException if {@code hashFunctions} is empty or contains null, or if
   *     {@code bitSize} is not in {@code (0, 2^32]}
   */
  public static <T extends Hashable> BloomFilter<T> create(
      long bitSize,
      List<? extends LongHashFunction<? super T>> hashFunctions
  )
  {
    Preconditions.checkNotNull(hashFunctions, "hashFunctions");
    checkBitSize(bitSize);
    InvalidConfigurationException.check(!hashFunctions.isEmpty(), "at least one hash function is required");
    InvalidConfigurationException.check(
        !Iterables.any(hashFunctions, Predicates.isNull()),
        "hash functions should not be null"
    );
    return new BloomFilter<T>(
        bitSize,
        ImmutableList.<LongHashFunction<? super T>>copyOf(hashFunctions),
        hashFunctions.size(),
        false
    );
  }

  /**
   * Creates a double hashing filter sized for {@code expectedInsertions} values at a false positive
   * probability of {@code fpp}.
   */
  public static <T extends Hashable> BloomFilter<T> forExpectedInsertions(long expectedInsertions, double fpp)
  {
    InvalidConfigurationException.check(
        expectedInsertions > 0,
        "expectedInsertions should be positive, got %s",
        expectedInsertions
    );
    InvalidConfigurationException.check(fpp > 0.0 && fpp < 1.0, "fpp should be in (0, 1), got %s", fpp);
    final long bitSize = optimalNumOfBits(expectedInsertions, fpp);
    return create(bitSize, optimalNumOfHashFunctions(expectedInsertions, bitSize));
  }

  /**
   * {@code -n ln(p) / (ln 2)^2}, at least 1.
   */
  public static long optimalNumOfBits(long n, double p)
  {
    return Math.max(1L, (long) Math.ceil(-n * Math.log(p) / (Math.log(2) * Math.log(2))));
  }

  /**
   * {@code m / n * ln 2} rounded, at least 1.
   */
  public static int optimalNumOfHashFunctions(long n, long m)
  {
    return Math.max(1, (int) Math.round((double) m / n * Math.log(2)));
  }

  private static void checkBitSize(long bitSize)
  {
    InvalidConfigurationException.check(
        bitSize > 0 && bitSize <= BitArray.MAX_BITS,
        "bitSize should be in (0, 2^32], got %s",
        bitSize
    );
  }

  public void add(T value)
  {
    if (doubleHashing) {
      final long hash = hashFunctions.get(0).hash(value);
      final int lo = (int) hash;
      final int hi = (int) (hash >>> 32);
      for (int i = 1; i <= numHashes; i++) {
        bits.set(position(lo + i * hi));
      }
      return;
    }
    for (LongHashFunction<? super T> fn : hashFunctions) {
      bits.set(Long.remainderUnsigned(fn.hash(value), bits.bitSize()));
    }
  }

  /**
   * @return false if {@code value} was definitely never added, true if it probably was
   */
  public boolean has(T value)
  {
    if (doubleHashing) {
      final long hash = hashFunctions.get(0).hash(value);
      final int lo = (int) hash;
      final int hi = (int) (hash >>> 32);
      for (int i = 1; i <= numHashes; i++) {
        if (!bits.get(position(lo + i * hi))) {
          return false;
        }
      }
      return true;
    }
    for (LongHashFunction<? super T> fn : hashFunctions) {
      if (!bits.get(Long.remainderUnsigned(fn.hash(value), bits.bitSize()))) {
        return false;
      }
    }
    return true;
  }

  // combined is an unsigned 32 bits value, wrapped like the lo + i * hi sum it comes from
  private long position(int combined)
  {
    return UnsignedInts.toLong(combined) % bits.bitSize();
  }

  public long bitSize()
  {
    return bits.bitSize();
  }

  public int numHashes()
  {
    return numHashes;
  }

  /**
   * Number of bits currently set.
   */
  public long bitCount()
  {
    return bits.bitCount();
  }

  /**
   * Probability that {@link #has(Hashable)} returns true for a value that was never added,
   * estimated from the current fill ratio.
   */
  public double expectedFpp()
  {
    return Math.pow((double) bits.bitCount() / bits.bitSize(), numHashes);
  }

  @Override
  public long memoryFootprint()
  {
    return bits.memoryFootprint();
  }

  /**
   * For filters built from explicit hash functions the name only captures the dimensions.
   */
  @Override
  public String name()
  {
    return "bloom" + bits.bitSize() + "x" + numHashes;
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
                      .add("bitSize", bits.bitSize())
                      .add("numHashes", numHashes)
                      .add("doubleHashing", doubleHashing)
                      .add("bitCount", bits.bitCount())
                      .toString();
  }
}
