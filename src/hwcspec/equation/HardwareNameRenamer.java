package hwcspec.equation;

import hwcspec.view.CounterView;
import hwcspec.view.IndexedView;

/**
 * Renames native counters in a resolved tree to their hardware source names.
 * Names that are not counters are kept as they are.
 */
public class HardwareNameRenamer extends EquationRewriter<RuntimeException> {
  private final IndexedView view;

  public HardwareNameRenamer(IndexedView view) { this.view = view; }

  @Override
  public EquationNode visitName(NameNode node) {
    return view.getByMachineName(node.name())
        .flatMap(CounterView::getSourceName)
        .<EquationNode>map(NameNode::new)
        .orElse(node);
  }
}
