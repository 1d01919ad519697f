package io.maybe.sketch;

import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.lessThan;

public class BloomFilterTest
{
  @Test
  public void testNoFalseNegativesOnRandomWordStream()
  {
    BloomFilter<Hashable> filter = BloomFilter.create(100, 7);
    Set<String> added = new HashSet<>();
    RandomWords words = new RandomWords(42);

    for (int i = 0; i <= 100_000; i++) {
      String word = words.next(5);
      if (!filter.has(Hashables.of(word)) && added.contains(word)) {
        Assert.fail("could not find word '" + word + "' after adding it");
      }
      added.add(word);
      filter.add(Hashables.of(word));
    }
  }

  @Test
  public void testAddedValuesAreFound()
  {
    BloomFilter<Hashable> filter = BloomFilter.create(10_000, 5);
    for (int i = 0; i < 1000; i++) {
      filter.add(Hashables.of(i));
      Assert.assertTrue(filter.has(Hashables.of(i)));
    }
    for (int i = 0; i < 1000; i++) {
      Assert.assertTrue(filter.has(Hashables.of(i)));
    }
  }

  @Test
  public void testEmptyFilterHasNothing()
  {
    BloomFilter<Hashable> filter = BloomFilter.create(1000, 3);
    Assert.assertFalse(filter.has(Hashables.of("a")));
    Assert.assertEquals(0, filter.bitCount());
    Assert.assertEquals(0.0, filter.expectedFpp(), 0.0);
  }

  @Test
  public void testAddingTwiceChangesNothing()
  {
    BloomFilter<Hashable> filter = BloomFilter.create(1000, 7);
    filter.add(Hashables.of("sofa"));
    long bitCount = filter.bitCount();

    filter.add(Hashables.of("sofa"));
    filter.add(Hashables.of("sofa"));
    Assert.assertEquals(bitCount, filter.bitCount());
  }

  @Test
  public void testDoubleHashingPositions()
  {
    Hashable value = Hashables.of("fridge");
    long hash = Hashes.murmur3Hash(value);
    int lo = (int) hash;
    int hi = (int) (hash >>> 32);
    Set<Long> positions = new HashSet<>();
    for (int i = 1; i <= 4; i++) {
      positions.add((((long) lo + (long) i * hi) & 0xFFFFFFFFL) % 1009);
    }

    BloomFilter<Hashable> filter = BloomFilter.create(1009, 4);
    filter.add(value);
    Assert.assertEquals(positions.size(), filter.bitCount());

    // a filter setting exactly those positions recognizes the value
    List<LongHashFunction<Hashable>> fns = new ArrayList<>();
    for (long position : positions) {
      fns.add(v -> position);
    }
    BloomFilter<Hashable> explicit = BloomFilter.create(1009, fns);
    Assert.assertFalse(explicit.has(value));
    explicit.add(Hashables.of("anything"));
    Assert.assertTrue(explicit.has(value));
  }

  @Test
  public void testExplicitHashFunctionsAreUnsigned()
  {
    // "a" hashes to 2^64 - 1, which is 5 mod 10 when read as unsigned; everything else hashes to 5
    LongHashFunction<Hashable> fn = v -> "a".equals(v.toString()) ? -1L : 5L;
    LongHashFunction<Hashable> three = v -> 3L;
    BloomFilter<Hashable> filter = BloomFilter.create(10, ImmutableList.of(fn, three));
    Assert.assertFalse(filter.has(Hashables.of("b")));

    filter.add(Hashables.of("a"));
    Assert.assertEquals(2, filter.bitCount());
    Assert.assertEquals(2, filter.numHashes());
    Assert.assertTrue(filter.has(Hashables.of("b")));
  }

  @Test
  public void testFalsePositiveRateForExpectedInsertions()
  {
    BloomFilter<Hashable> filter = BloomFilter.forExpectedInsertions(10_000, 0.01);
    Assert.assertEquals(BloomFilter.optimalNumOfBits(10_000, 0.01), filter.bitSize());
    for (int i = 0; i < 10_000; i++) {
      filter.add(Hashables.of(i));
    }

    int falsePositives = 0;
    for (int i = 10_000; i < 20_000; i++) {
      if (filter.has(Hashables.of(i))) {
        falsePositives++;
      }
    }
    assertThat(falsePositives / 10_000.0, lessThan(0.03));
    assertThat(filter.expectedFpp(), lessThan(0.03));
  }

  @Test
  public void testOptimalSizing()
  {
    Assert.assertEquals(9586, BloomFilter.optimalNumOfBits(1000, 0.01));
    Assert.assertEquals(7, BloomFilter.optimalNumOfHashFunctions(1000, 9586));
    Assert.assertEquals(1, BloomFilter.optimalNumOfHashFunctions(1000, 10));
  }

  @Test
  public void testEmptyHashFunctionList()
  {
    InvalidConfigurationException e = Assert.assertThrows(
        InvalidConfigurationException.class,
        () -> BloomFilter.create(100, Collections.<LongHashFunction<Hashable>>emptyList())
    );
    assertThat(e.getMessage(), containsString("at least one hash function"));
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testNullHashFunction()
  {
    List<LongHashFunction<Hashable>> fns = new ArrayList<>();
    fns.add(null);
    BloomFilter.create(100, fns);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testZeroHashes()
  {
    BloomFilter.create(100, 0);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testZeroSize()
  {
    BloomFilter.create(0, 3);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testSizeAboveTwoToTheThirtyTwo()
  {
    BloomFilter.create((1L << 32) + 1, 3);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testInvalidFpp()
  {
    BloomFilter.forExpectedInsertions(100, 1.0);
  }

  @Test
  public void testNameAndFootprint()
  {
    BloomFilter<Hashable> filter = BloomFilter.create(100, 7);
    Assert.assertEquals("bloom100x7", filter.name());
    Assert.assertEquals(16, filter.memoryFootprint());
    assertThat(filter.toString(), containsString("bitSize=100"));
  }
}
