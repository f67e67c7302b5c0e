package hwcspec.equation;

/**
 * Parse failure of an equation, attached to the owning counter instead of being raised.
 * @param original the equation text as written
 * @param message the parser diagnostic
 */
public record EquationError(String original, String message) {
  @Override
  public String toString() {
    return message + " in '" + original + "'";
  }
}
