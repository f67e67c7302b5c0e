package hwcspec.doc;

/**
 * A symbolic reference found in documentation text, written as {@code {{type::name.part}}}.
 * @param token the complete token including braces
 * @param type the reference type, {@link #TYPE_CONSTANT} or {@link #TYPE_COUNTER} when valid
 * @param name the referenced constant or counter machine name
 * @param part the part after the first '.', or the empty string
 */
public record DocReference(String token, String type, String name, String part) {
  public static final String TYPE_CONSTANT = "K";
  public static final String TYPE_COUNTER = "C";
  public static final String CONSTANT_GPU_NAME = "GPU_NAME";
  public static final String PART_EQUATION = "equation";

  public boolean isConstant() { return type.equals(TYPE_CONSTANT); }
  public boolean isCounter() { return type.equals(TYPE_COUNTER); }

  /** @return the text between the braces */
  public String body() { return token.substring(2, token.length() - 2); }
}
