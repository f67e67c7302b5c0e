package hwcspec.equation;

/**
 * Thrown when a derived equation cannot be expanded down to native counters, constants and literals.
 */
public class EquationResolveException extends Exception {
  private static final long serialVersionUID = 1L;

  public EquationResolveException(String message) { super(message); }
}
