package hwcspec.equation;

import hwcspec.equation.BinaryNode.Operator;
import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * Renders an equation tree as canonical text.
 * <p>
 * A binary operand is wrapped in parentheses iff it is itself a binary operation
 * whose operator or precedence class differs from its parent's.
 * Before rendering, the tree is brought into the shape its text parses back to: a right operand
 * with the parent's operator is rotated to the left, as {@code a * (b * c)} prints as {@code a * b * c}.
 * Multiplicative nodes then get a small set of peephole rewrites, tried in this order:
 * <ol>
 * <li>{@code x * 1} and {@code x / 1} print as {@code x}</li>
 * <li>{@code 1 * y} prints as {@code y}</li>
 * <li>a literal multiplied or divided by a literal folds into one literal</li>
 * <li>{@code (a * lit1) * lit2} prints as {@code a * lit}, with {@code lit = lit1 * lit2}</li>
 * </ol>
 * Rotation and rewrites repeat until neither changes the tree, so printing the output again gives the same text.
 * No other algebraic identities are applied.
 */
public class EquationPrinter implements EquationVisitor<EquationPrinter.Rendered, RuntimeException> {

  private static final EquationPrinter INSTANCE = new EquationPrinter();

  /** Intermediate rendering of a subtree. */
  sealed interface Rendered permits Atom, Operation {
    String text();
  }

  /** A name, literal or function call; never parenthesized. */
  record Atom(String text) implements Rendered {}

  /** A binary operation whose operand texts already carry any needed parentheses. */
  record Operation(String left, Operator op, String right) implements Rendered {
    public String text() { return left + " " + op.symbol + " " + right; }
  }

  /**
   * Pretty-prints an equation tree.
   * @param node the root node
   * @return the canonical text
   */
  public static String print(EquationNode node) { return canonical(node).accept(INSTANCE).text(); }

  /**
   * Brings a tree into printed form: same-operator chains rotated left and all peephole rewrites applied.
   * @param node the root node
   * @return the canonical tree, which prints and parses back unchanged
   */
  public static EquationNode canonical(EquationNode node) {
    EquationNode current = node;
    while (true) {
      EquationNode next = Simplifier.INSTANCE.rewrite(Rotator.INSTANCE.rewrite(current));
      if (next.equals(current))
        return current;
      current = next;
    }
  }

  private static boolean isOne(EquationNode node) { return node instanceof LiteralNode literal && literal.text().equals("1"); }

  /** Rotates right operands sharing their parent's operator to the left, matching how the printed text parses. */
  private static class Rotator extends EquationRewriter<RuntimeException> {
    static final Rotator INSTANCE = new Rotator();

    @Override
    public EquationNode visitBinary(BinaryNode node) {
      return join(node.left().accept(this), node.op(), node.right().accept(this));
    }

    private static EquationNode join(EquationNode left, Operator op, EquationNode right) {
      if (right instanceof BinaryNode chain && chain.op() == op)
        return join(join(left, op, chain.left()), op, chain.right());
      return new BinaryNode(left, op, right);
    }
  }

  /** Applies the multiplicative peephole rewrites bottom-up. */
  private static class Simplifier extends EquationRewriter<RuntimeException> {
    static final Simplifier INSTANCE = new Simplifier();

    @Override
    public EquationNode visitBinary(BinaryNode node) {
      return simplify(node.left().accept(this), node.op(), node.right().accept(this));
    }

    private static EquationNode simplify(EquationNode left, Operator op, EquationNode right) {
      if (op.precedence == 0)
        return new BinaryNode(left, op, right);

      if (isOne(right))
        return left;
      if (op == Operator.MUL && isOne(left))
        return right;

      if (left instanceof LiteralNode a && right instanceof LiteralNode b) {
        double folded = (op == Operator.MUL) ? a.value() * b.value() : a.value() / b.value();
        if (Double.isFinite(folded))
          return new LiteralNode(toLiteral(folded));
      }

      if (op == Operator.MUL && right instanceof LiteralNode b && left instanceof BinaryNode inner && inner.op() == Operator.MUL &&
          inner.right() instanceof LiteralNode a) {
        double folded = a.value() * b.value();
        if (Double.isFinite(folded))
          return simplify(inner.left(), Operator.MUL, new LiteralNode(toLiteral(folded)));
      }

      return new BinaryNode(left, op, right);
    }
  }

  /**
   * Formats a number the way folded literals are written: as an integer if the value is integral, else in plain decimal notation.
   * @param value a finite value
   * @return the literal text
   */
  public static String toLiteral(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e18)
      return Long.toString((long)value);
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  private static String operand(Rendered operand, Operator parent) {
    if (operand instanceof Operation child && (child.op() != parent || child.op().precedence != parent.precedence))
      return "(" + child.text() + ")";
    return operand.text();
  }

  private static Operation operation(Rendered left, Operator op, Rendered right) {
    return new Operation(operand(left, op), op, operand(right, op));
  }

  @Override
  public Rendered visitLiteral(LiteralNode node) {
    return new Atom(node.text());
  }

  @Override
  public Rendered visitName(NameNode node) {
    return new Atom(node.name());
  }

  @Override
  public Rendered visitCall(CallNode node) {
    return new Atom(node.function() + node.args().stream().map(arg -> arg.accept(this).text()).collect(Collectors.joining(", ", "(", ")")));
  }

  @Override
  public Rendered visitBinary(BinaryNode node) {
    return operation(node.left().accept(this), node.op(), node.right().accept(this));
  }
}
