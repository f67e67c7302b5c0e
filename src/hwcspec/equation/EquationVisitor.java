package hwcspec.equation;

/**
 * Visitor over {@link EquationNode} trees.
 * @param <R> result type
 * @param <E> exception type the visitor may raise, {@link RuntimeException} for infallible visitors
 */
public interface EquationVisitor<R, E extends Exception> {
  R visitLiteral(LiteralNode node) throws E;
  R visitName(NameNode node) throws E;
  R visitBinary(BinaryNode node) throws E;
  R visitCall(CallNode node) throws E;
}
