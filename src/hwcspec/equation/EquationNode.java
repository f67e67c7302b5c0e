package hwcspec.equation;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of a parsed counter equation.
 * The node family is closed, so every {@link EquationVisitor} handles all node kinds.
 */
public sealed interface EquationNode permits LiteralNode, NameNode, BinaryNode, CallNode {

  /**
   * Dispatches to the matching visitor method.
   * @param visitor the visitor to apply
   * @return the visitor result
   * @throws E if the visitor fails
   */
  <R, E extends Exception> R accept(EquationVisitor<R, E> visitor) throws E;

  /**
   * Collects all leaf names of this tree, left to right, including duplicates.
   * @return the list of names
   */
  default List<String> names() {
    List<String> ret = new ArrayList<>();
    collectNames(this, ret);
    return ret;
  }

  private static void collectNames(EquationNode node, List<String> out) {
    if (node instanceof NameNode name) {
      out.add(name.name());
    } else if (node instanceof BinaryNode binary) {
      collectNames(binary.left(), out);
      collectNames(binary.right(), out);
    } else if (node instanceof CallNode call) {
      call.args().forEach(arg -> collectNames(arg, out));
    }
  }
}
