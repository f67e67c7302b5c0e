package hwcspec.data;

/**
 * Thrown when a database file cannot be read or contains a malformed entry.
 */
public class SpecFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  public SpecFormatException(String message) { super(message); }

  public SpecFormatException(String message, Throwable cause) { super(message, cause); }
}
