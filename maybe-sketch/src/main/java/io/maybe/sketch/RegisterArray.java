package io.maybe.sketch;

import com.google.common.base.Preconditions;

/**
 * Byte registers addressed by {@code long} indexes. Storage is split into pages so that more than
 * {@code Integer.MAX_VALUE} registers can be held.
 */
final class RegisterArray
{
  private static final int PAGE_SHIFT = 20;
  private static final int PAGE_SIZE = 1 << PAGE_SHIFT;
  private static final int PAGE_MASK = PAGE_SIZE - 1;

  private final byte[][] pages;
  private final long size;

  RegisterArray(long size)
  {
    Preconditions.checkArgument(size > 0, "size should be positive: %s", size);
    final long numPages = (size + PAGE_SIZE - 1) >>> PAGE_SHIFT;
    this.pages = new byte[Math.toIntExact(numPages)][];
    for (int i = 0; i < pages.length; i++) {
      final long remaining = size - ((long) i << PAGE_SHIFT);
      pages[i] = new byte[(int) Math.min(PAGE_SIZE, remaining)];
    }
    this.size = size;
  }

  int get(long index)
  {
    return pages[(int) (index >>> PAGE_SHIFT)][(int) (index & PAGE_MASK)];
  }

  /**
   * Raises the register at {@code index} to {@code value} if it is lower.
   */
  void max(long index, int value)
  {
    final byte[] page = pages[(int) (index >>> PAGE_SHIFT)];
    final int offset = (int) (index & PAGE_MASK);
    // registers never exceed 65, so signed comparison is fine
    if (page[offset] < value) {
      page[offset] = (byte) value;
    }
  }

  long size()
  {
    return size;
  }
}
