package io.maybe.sketch;

/**
 * Thrown by the factories of this package when a structure cannot be built from the given parameters.
 * No instance is created in that case.
 */
public class InvalidConfigurationException extends IllegalArgumentException
{
  public InvalidConfigurationException(String message)
  {
    super(message);
  }

  public InvalidConfigurationException(String message, Throwable cause)
  {
    super(message, cause);
  }

  static void check(boolean expression, String template, Object... args)
  {
    if (!expression) {
      throw new InvalidConfigurationException(String.format(template, args));
    }
  }
}
