package hwcspec.equation;

import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Binary arithmetic operation.
 */
public record BinaryNode(EquationNode left, Operator op, EquationNode right) implements EquationNode {

  public enum Operator {
    ADD("+", 0),
    SUB("-", 0),
    MUL("*", 1),
    DIV("/", 1);

    public final String symbol;
    /** 0 for additive, 1 for multiplicative operators */
    public final int precedence;

    private Operator(String symbol, int precedence) {
      this.symbol = symbol;
      this.precedence = precedence;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
      return Stream.of(values()).filter(op -> op.symbol.equals(symbol)).findAny();
    }
  }

  public BinaryNode {
    Objects.requireNonNull(left);
    Objects.requireNonNull(op);
    Objects.requireNonNull(right);
  }

  @Override
  public <R, E extends Exception> R accept(EquationVisitor<R, E> visitor) throws E {
    return visitor.visitBinary(this);
  }

  @Override
  public String toString() {
    return "[" + left + " " + op.symbol + " " + right + "]";
  }
}
