package hwcspec.equation;

import java.util.Objects;

/**
 * Symbol reference: a counter machine name, a symbolic constant, or after renaming a name in another dialect.
 * The printer treats the name as an opaque atom.
 */
public record NameNode(String name) implements EquationNode {
  public NameNode {
    Objects.requireNonNull(name);
  }

  @Override
  public <R, E extends Exception> R accept(EquationVisitor<R, E> visitor) throws E {
    return visitor.visitName(this);
  }

  @Override
  public String toString() {
    return name;
  }
}
