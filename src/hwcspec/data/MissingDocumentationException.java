package hwcspec.data;

/**
 * Thrown when no documentation entry applies to a product.
 */
public class MissingDocumentationException extends Exception {
  private static final long serialVersionUID = 1L;

  public MissingDocumentationException(String message) { super(message); }
}
