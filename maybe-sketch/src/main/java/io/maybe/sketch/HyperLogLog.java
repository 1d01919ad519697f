package io.maybe.sketch;

import com.google.common.base.MoreObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>Uses the 64 bits MurmurHash3 of each value with a precision {@code b}, {@code 0 <= b <= 32}:
 * <ul>
 *   <li>the {@code b} most significant bits select one of {@code m = 2^b} registers;
 *   <li>the register keeps the highest rank seen, where rank is one plus the number of leading zeros of
 *   the remaining {@code 64 - b} bits.
 * </ul>
 * The relative standard error is about {@code 1.04 / sqrt(m)}.
 *
 * <p>Differences from paper
 * <ul>
 *   <li>each register takes 8-bits instead of 5-bits
 *   <li>the small range correction applies below {@code 2.5 * m} when some register is still zero, and
 *   there is no large range correction, so estimates close to {@code 2^32} and above are not corrected
 * </ul>
 *
 * <p>Not thread-safe, see {@link Sketch}.
 */
public final class HyperLogLog<T extends Hashable> implements Sketch
{
  private static final Logger LOG = LoggerFactory.getLogger(HyperLogLog.class);

  public static final int MAX_PRECISION = 32;

  private final int p;
  private final long m;
  // alpha already multiplied by m^2
  private final double alphaMM;
  private final LongHashFunction<T> hashFunction;
  private final RegisterArray registers;

  private HyperLogLog(int precision)
  {
    this.p = precision;
    this.m = 1L << precision;
    this.alphaMM = alphaMM(precision, m);
    this.hashFunction = Hashes.murmur3();
    this.registers = new RegisterArray(m);
    LOG.debug("Created hyperloglog with precision {} ({} registers)", precision, m);
  }

  /**
   * @throws InvalidConfigurationException if {@code precision} is not in {@code [0, 32]}
   */
  public static <T extends Hashable> HyperLogLog<T> create(int precision)
  {
    InvalidConfigurationException.check(
        precision >= 0 && precision <= MAX_PRECISION,
        "invalid precision [%s] : should be in [0, %s]",
        precision,
        MAX_PRECISION
    );
    return new HyperLogLog<>(precision);
  }

  /**
   * Creates an instance whose relative standard error is at most {@code error}.
   */
  public static <T extends Hashable> HyperLogLog<T> forError(double error)
  {
    return create(precisionForError(error));
  }

  /**
   * Smallest precision with {@code 1.04 / sqrt(2^p) <= error}.
   */
  public static int precisionForError(double error)
  {
    InvalidConfigurationException.check(error > 0.0 && error < 1.0, "error should be in (0, 1), got %s", error);
    return Math.max(0, (int) Math.ceil(2.0 * Math.log(1.04 / error) / Math.log(2.0)));
  }

  private static double alphaMM(int p, long m)
  {
    final double mm = (double) m * m;
    switch (p) {
      case 4:
        return 0.673 * mm;
      case 5:
        return 0.697 * mm;
      case 6:
        return 0.709 * mm;
      default:
        return (0.7213 / (1 + 1.079 / m)) * mm;
    }
  }

  public void add(T value)
  {
    add64BitsHash(hashFunction.hash(value));
  }

  private void add64BitsHash(long hash)
  {
    if (p == 0) {
      registers.max(0, Long.numberOfLeadingZeros(hash) + 1);
      return;
    }
    final long bucket = hash >>> (Long.SIZE - p);
    final long window = hash & ((1L << (Long.SIZE - p)) - 1);
    // window keeps its p high bits cleared, they are counted as leading zeros and taken off again
    final int rank = Long.numberOfLeadingZeros(window) - p + 1;
    registers.max(bucket, rank);
  }

  public long cardinality()
  {
    double registerSum = 0.0;
    long zeros = 0;
    for (long i = 0; i < m; i++) {
      final int register = registers.get(i);
      registerSum += Math.scalb(1.0, -register);
      if (register == 0) {
        zeros++;
      }
    }

    final double e = alphaMM / registerSum;
    if (e < 2.5d * m && zeros != 0) { // small range correction
      return Math.round(m * Math.log(m / (double) zeros));
    }
    return Math.round(e);
  }

  public int precision()
  {
    return p;
  }

  public long registerCount()
  {
    return m;
  }

  public double relativeStandardError()
  {
    return 1.04 / Math.sqrt(m);
  }

  @Override
  public long memoryFootprint()
  {
    return registers.size(); // one byte per register
  }

  @Override
  public String name()
  {
    return "hll" + p;
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
                      .add("precision", p)
                      .add("registers", m)
                      .toString();
  }
}
