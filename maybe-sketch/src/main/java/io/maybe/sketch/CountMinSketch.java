package io.maybe.sketch;

import com.google.common.base.MoreObjects;
import com.google.common.primitives.UnsignedLongs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Count-Min Sketch as described in Cormode and Muthukrishnan, "An Improved Data Stream Summary:
 * The Count-Min Sketch and its Applications".
 *
 * <p>A {@code depth x width} table of counters, row {@code i} addressed by {@code murmur3().derive(i + 1)}.
 * {@link #count(Hashable)} is the minimum of the value's counters over all rows, so it is never below the
 * number of times the value was added, and overestimates only through collisions in every row.
 *
 * <p>Counters and counts are unsigned 64 bits values held in {@code long}s. A counter that would exceed
 * {@code 2^64 - 1} stays at that value.
 *
 * <p>Not thread-safe, see {@link Sketch}.
 */
public final class CountMinSketch<T extends Hashable> implements Sketch
{
  private static final Logger LOG = LoggerFactory.getLogger(CountMinSketch.class);

  private static final long MAX_UNSIGNED = -1L;

  private final int width;
  private final int depth;
  private final long[][] table;
  private final List<LongHashFunction<T>> rowHashes;
  private long totalCount;

  private CountMinSketch(int width, int depth)
  {
    this.width = width;
    this.depth = depth;
    this.table = new long[depth][width];
    this.rowHashes = new ArrayList<>(depth);
    for (int i = 1; i <= depth; i++) {
      rowHashes.add(Hashes.murmur3(i));
    }
    LOG.debug("Created count-min sketch of width {} and depth {}", width, depth);
  }

  /**
   * @throws InvalidConfigurationException if {@code width} or {@code depth} is not positive
   */
  public static <T extends Hashable> CountMinSketch<T> create(int width, int depth)
  {
    InvalidConfigurationException.check(width > 0, "width should be positive, got %s", width);
    InvalidConfigurationException.check(depth > 0, "depth should be positive, got %s", depth);
    return new CountMinSketch<>(width, depth);
  }

  /**
   * Sizes a sketch so that, with probability {@code confidence}, an estimate exceeds the true count
   * by at most {@code eps} times the total count.
   */
  public static <T extends Hashable> CountMinSketch<T> forAccuracy(double eps, double confidence)
  {
    InvalidConfigurationException.check(eps > 0.0 && eps < 1.0, "eps should be in (0, 1), got %s", eps);
    InvalidConfigurationException.check(
        confidence > 0.0 && confidence < 1.0,
        "confidence should be in (0, 1), got %s",
        confidence
    );
    final int width = (int) Math.ceil(2 / eps);
    final int depth = (int) Math.ceil(-Math.log(1 - confidence) / Math.log(2));
    return create(width, depth);
  }

  public void increment(T value)
  {
    add(value, 1);
  }

  /**
   * Adds {@code count}, read as an unsigned value, to the counters of {@code value} in every row.
   */
  public void add(T value, long count)
  {
    for (int i = 0; i < depth; i++) {
      final long[] row = table[i];
      final int j = column(i, value);
      row[j] = saturatedAdd(row[j], count);
    }
    totalCount = saturatedAdd(totalCount, count);
  }

  /**
   * Estimated number of times {@code value} was added, as an unsigned value. Never less than the true count.
   */
  public long count(T value)
  {
    long min = MAX_UNSIGNED;
    for (int i = 0; i < depth; i++) {
      min = UnsignedLongs.min(min, table[i][column(i, value)]);
    }
    return min;
  }

  private int column(int row, T value)
  {
    return (int) Long.remainderUnsigned(rowHashes.get(row).hash(value), width);
  }

  private static long saturatedAdd(long a, long b)
  {
    final long sum = a + b;
    // unsigned overflow iff the sum wrapped below one of the operands
    return Long.compareUnsigned(sum, a) < 0 ? MAX_UNSIGNED : sum;
  }

  public int width()
  {
    return width;
  }

  public int depth()
  {
    return depth;
  }

  /**
   * Sum of all counts added so far, as an unsigned value.
   */
  public long totalCount()
  {
    return totalCount;
  }

  public double relativeError()
  {
    return 2.0 / width;
  }

  public double confidence()
  {
    return 1 - 1 / Math.pow(2, depth);
  }

  @Override
  public long memoryFootprint()
  {
    return (long) width * depth * Long.BYTES;
  }

  @Override
  public String name()
  {
    return "cms" + width + "x" + depth;
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
                      .add("width", width)
                      .add("depth", depth)
                      .add("totalCount", UnsignedLongs.toString(totalCount))
                      .toString();
  }
}
