package hwcspec.equation;

/**
 * Thrown by {@link EquationParser#parse(String)} for malformed equation text.
 */
public class EquationSyntaxException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String original;
  private final int column;

  public EquationSyntaxException(String original, int column, String message) {
    super(message);
    this.original = original;
    this.column = column;
  }

  public String getOriginal() { return original; }

  /** @return the 1-based column of the offending token */
  public int getColumn() { return column; }

  public EquationError toError() { return new EquationError(original, getMessage()); }
}
