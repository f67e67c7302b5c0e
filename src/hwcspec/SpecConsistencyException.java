package hwcspec;

/**
 * Internal-consistency failure: the loaded databases do not fit together, e.g. a hardware layout slot
 * without a counter entry. Stops the current build.
 */
public class SpecConsistencyException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public SpecConsistencyException(String message) { super(message); }
}
