package io.maybe.sketch;

import com.google.common.base.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds structures from compact names:
 * <ul>
 *   <li>{@code bloom<bits>x<hashes>}, e.g. {@code bloom100x7}
 *   <li>{@code cms<width>x<depth>}, e.g. {@code cms2014x5}
 *   <li>{@code hll<precision>}, e.g. {@code hll12}, or {@code hll} for precision 14
 * </ul>
 * {@link Sketch#name()} returns names in the same format.
 */
public final class Sketches
{
  private static final Logger LOG = LoggerFactory.getLogger(Sketches.class);

  private static final int DEFAULT_PRECISION = 14;

  private static final Pattern BLOOM = Pattern.compile("bloom(\\d+)x(\\d+)");
  private static final Pattern CMS = Pattern.compile("cms(\\d+)x(\\d+)");
  private static final Pattern HLL = Pattern.compile("hll(\\d*)");

  private Sketches()
  {
  }

  public static Sketch get(String name)
  {
    if (name.startsWith("bloom")) {
      return bloomFilter(name);
    }
    if (name.startsWith("cms")) {
      return countMinSketch(name);
    }
    if (name.startsWith("hll")) {
      return hyperLogLog(name);
    }
    throw new IllegalArgumentException("Unknown sketch : " + name);
  }

  public static Supplier<Sketch> lazyGet(String name)
  {
    return () -> get(name);
  }

  public static <T extends Hashable> BloomFilter<T> bloomFilter(String name)
  {
    final Matcher matcher = match(BLOOM, name);
    return BloomFilter.create(parseLong(matcher.group(1), name), parseInt(matcher.group(2), name));
  }

  public static <T extends Hashable> CountMinSketch<T> countMinSketch(String name)
  {
    final Matcher matcher = match(CMS, name);
    return CountMinSketch.create(parseInt(matcher.group(1), name), parseInt(matcher.group(2), name));
  }

  public static <T extends Hashable> HyperLogLog<T> hyperLogLog(String name)
  {
    final Matcher matcher = match(HLL, name);
    final String pStr = matcher.group(1);
    return HyperLogLog.create(pStr.isEmpty() ? DEFAULT_PRECISION : parseInt(pStr, name));
  }

  private static Matcher match(Pattern pattern, String name)
  {
    final Matcher matcher = pattern.matcher(name);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Unknown sketch : " + name);
    }
    LOG.debug("Resolved sketch name [{}]", name);
    return matcher;
  }

  private static long parseLong(String digits, String name)
  {
    try {
      return Long.parseLong(digits);
    }
    catch (NumberFormatException e) {
      throw new InvalidConfigurationException("size out of range in sketch name : " + name, e);
    }
  }

  private static int parseInt(String digits, String name)
  {
    try {
      return Integer.parseInt(digits);
    }
    catch (NumberFormatException e) {
      throw new InvalidConfigurationException("size out of range in sketch name : " + name, e);
    }
  }
}
