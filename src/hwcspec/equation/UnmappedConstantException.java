package hwcspec.equation;

/**
 * Thrown when a symbolic constant has no spelling in the target dialect.
 */
public class UnmappedConstantException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String constant;

  public UnmappedConstantException(String constant) {
    super("No mapping for constant " + constant);
    this.constant = constant;
  }

  public String getConstant() { return constant; }
}
