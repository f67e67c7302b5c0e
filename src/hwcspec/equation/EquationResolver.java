package hwcspec.equation;

import hwcspec.view.CounterView;
import hwcspec.view.IndexedView;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Expands references to derived counters until only native counters, constants and literals remain.
 * The chain of counters currently being expanded is tracked, so cyclic derivations fail instead of recursing forever.
 */
public class EquationResolver {
  /** Names matching this pattern are product constants, resolved by the consumer at measurement time. */
  public static final Pattern CONSTANT_PATTERN = Pattern.compile("^[A-Z0-9_]+$");

  private final IndexedView view;

  public EquationResolver(IndexedView view) { this.view = view; }

  public static boolean isConstant(String name) { return CONSTANT_PATTERN.matcher(name).matches(); }

  /**
   * Resolves the equation of a derived counter.
   * @param counter the counter to resolve; its own name seeds the cycle check
   * @return the resolved tree
   * @throws EquationResolveException on a missing or cyclic reference
   */
  public EquationNode resolve(CounterView counter) throws EquationResolveException {
    LinkedHashSet<String> path = new LinkedHashSet<>();
    path.add(key(counter.getMachineName()));
    return expand(counter, path);
  }

  /**
   * Resolves a free-standing equation tree against the view.
   * @param ast the tree to resolve
   * @return the resolved tree
   * @throws EquationResolveException on a missing or cyclic reference
   */
  public EquationNode resolve(EquationNode ast) throws EquationResolveException {
    return new ResolveRewriter(new LinkedHashSet<>()).rewrite(ast);
  }

  private static String key(String machineName) { return machineName.toLowerCase(Locale.ROOT); }

  private EquationNode expand(CounterView counter, LinkedHashSet<String> path) throws EquationResolveException {
    Optional<EquationNode> ast = counter.getEquationAst();
    if (ast.isEmpty())
      throw new EquationResolveException("Derived counter " + counter.getMachineName() + " has no valid equation");
    return new ResolveRewriter(path).rewrite(ast.get());
  }

  private class ResolveRewriter extends EquationRewriter<EquationResolveException> {
    private final LinkedHashSet<String> path;

    ResolveRewriter(LinkedHashSet<String> path) { this.path = path; }

    @Override
    public EquationNode visitName(NameNode node) throws EquationResolveException {
      String name = node.name();
      if (isConstant(name))
        return node;

      CounterView counter = view.getByMachineName(name).orElseThrow(() -> new EquationResolveException("Missing counter: " + name));
      if (!counter.isDerived())
        return node;

      String counterKey = key(counter.getMachineName());
      if (!path.add(counterKey)) {
        throw new EquationResolveException("Cyclic derivation: " + String.join(" -> ", path) + " -> " + counterKey);
      }
      EquationNode expanded = expand(counter, path);
      path.remove(counterKey);
      return expanded;
    }
  }
}
