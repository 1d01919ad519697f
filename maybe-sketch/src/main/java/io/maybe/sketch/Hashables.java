package io.maybe.sketch;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * {@link Hashable} adapters for common value types.
 */
public final class Hashables
{
  private Hashables()
  {
  }

  /**
   * UTF-8 bytes of {@code value}.
   */
  public static Hashable of(String value)
  {
    Preconditions.checkNotNull(value, "value");
    return new BytesValue(value.getBytes(StandardCharsets.UTF_8), value);
  }

  /**
   * 4 bytes, big-endian.
   */
  public static Hashable of(int value)
  {
    return new BytesValue(Ints.toByteArray(value), value);
  }

  /**
   * 8 bytes, big-endian.
   */
  public static Hashable of(long value)
  {
    return new BytesValue(Longs.toByteArray(value), value);
  }

  public static Hashable of(byte[] value)
  {
    Preconditions.checkNotNull(value, "value");
    return new BytesValue(value.clone(), null);
  }

  private static final class BytesValue implements Hashable
  {
    private final byte[] bytes;
    private final Object source; // only used by toString

    BytesValue(byte[] bytes, Object source)
    {
      this.bytes = bytes;
      this.source = source;
    }

    @Override
    public byte[] bytes()
    {
      return bytes.clone();
    }

    @Override
    public boolean equals(Object o)
    {
      if (this == o) {
        return true;
      }
      if (!(o instanceof BytesValue)) {
        return false;
      }
      return Arrays.equals(bytes, ((BytesValue) o).bytes);
    }

    @Override
    public int hashCode()
    {
      return Arrays.hashCode(bytes);
    }

    @Override
    public String toString()
    {
      return source != null ? String.valueOf(source) : Arrays.toString(bytes);
    }
  }
}
