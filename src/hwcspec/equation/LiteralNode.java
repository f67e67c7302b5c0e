package hwcspec.equation;

import java.util.Objects;

/**
 * Numeric literal, kept in the spelling it was written with.
 */
public record LiteralNode(String text) implements EquationNode {
  public LiteralNode {
    Objects.requireNonNull(text);
  }

  /** @return the numeric value of the literal */
  public double value() { return Double.parseDouble(text); }

  @Override
  public <R, E extends Exception> R accept(EquationVisitor<R, E> visitor) throws E {
    return visitor.visitLiteral(this);
  }

  @Override
  public String toString() {
    return text;
  }
}
