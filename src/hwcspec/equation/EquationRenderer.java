package hwcspec.equation;

import hwcspec.view.CounterView;
import hwcspec.view.IndexedView;

/**
 * Renders counter expressions in each output dialect.
 * Counters measured in percent are clamped to {@code [0, 100]}, hiding approximation error in visualizations.
 */
public final class EquationRenderer {
  public static final String PERCENT_UNIT = "percent";

  private EquationRenderer() {}

  /**
   * Renders the resolved equation of a derived counter using machine names.
   * @param view the product view the counter belongs to
   * @param counter a derived counter with a resolved equation
   * @return the expression text
   */
  public static String machineNameExpression(IndexedView view, CounterView counter) {
    return clamp(counter, EquationPrinter.print(resolved(counter)));
  }

  /**
   * Renders the resolved equation of a derived counter using hardware source names.
   * @param view the product view the counter belongs to
   * @param counter a derived counter with a resolved equation
   * @return the expression text
   */
  public static String sourceNameExpression(IndexedView view, CounterView counter) {
    return clamp(counter, EquationPrinter.print(new HardwareNameRenamer(view).rewrite(resolved(counter))));
  }

  /**
   * Renders a counter in the Streamline dialect. A native counter renders as its own mangled name.
   * @param view the product view the counter belongs to
   * @param counter the counter
   * @return the expression text
   * @throws UnmappedConstantException if the equation uses a constant Streamline has no name for
   */
  public static String streamlineExpression(IndexedView view, CounterView counter) {
    EquationNode ast = counter.isDerived() ? resolved(counter) : new NameNode(counter.getMachineName());
    return clamp(counter, EquationPrinter.print(new StreamlineNameRenamer(view).rewrite(ast)));
  }

  /**
   * Renders an unresolved equation as authored, using machine names.
   * @param ast the equation tree
   * @return the expression text
   */
  public static String equationText(EquationNode ast) { return EquationPrinter.print(ast); }

  private static EquationNode resolved(CounterView counter) {
    return counter.getEquationAstResolved().orElseThrow(
        () -> new IllegalStateException("Counter " + counter.getMachineName() + " has no resolved equation"));
  }

  private static String clamp(CounterView counter, String equation) {
    if (PERCENT_UNIT.equals(counter.getUnits()))
      return "max(min(" + equation + ", 100), 0)";
    return equation;
  }
}
