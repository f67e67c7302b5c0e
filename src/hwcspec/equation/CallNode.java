package hwcspec.equation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Function call such as {@code min(A, B)}.
 */
public record CallNode(String function, List<EquationNode> args) implements EquationNode {
  public CallNode {
    Objects.requireNonNull(function);
    args = List.copyOf(args);
  }

  @Override
  public <R, E extends Exception> R accept(EquationVisitor<R, E> visitor) throws E {
    return visitor.visitCall(this);
  }

  @Override
  public String toString() {
    return function + args.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
  }
}
