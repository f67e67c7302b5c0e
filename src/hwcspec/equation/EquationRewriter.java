package hwcspec.equation;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for bottom-up tree rewrites. By default the tree is copied unchanged,
 * subclasses override the node kinds they rewrite.
 */
public abstract class EquationRewriter<E extends Exception> implements EquationVisitor<EquationNode, E> {

  public EquationNode rewrite(EquationNode node) throws E { return node.accept(this); }

  @Override
  public EquationNode visitLiteral(LiteralNode node) throws E {
    return node;
  }

  @Override
  public EquationNode visitName(NameNode node) throws E {
    return node;
  }

  @Override
  public EquationNode visitBinary(BinaryNode node) throws E {
    EquationNode left = node.left().accept(this);
    EquationNode right = node.right().accept(this);
    if (left == node.left() && right == node.right())
      return node;
    return new BinaryNode(left, node.op(), right);
  }

  @Override
  public EquationNode visitCall(CallNode node) throws E {
    List<EquationNode> args = new ArrayList<>(node.args().size());
    for (EquationNode arg : node.args())
      args.add(arg.accept(this));
    return new CallNode(node.function(), args);
  }
}
