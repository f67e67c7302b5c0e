package hwcspec.view;

import hwcspec.SpecConsistencyException;
import hwcspec.data.CounterVisibility;
import hwcspec.data.HardwareBlockLayout;
import hwcspec.data.HardwareBlockType;
import hwcspec.data.HardwareCounterLayout;
import hwcspec.data.HardwareLayout;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Counters of one product grouped by hardware block, in hardware layout order.
 */
public class HardwareView {

  /** The counters of one hardware block. Never empty. */
  public record HardwareBlockView(HardwareBlockType type, List<CounterView> counters) {
    public HardwareBlockView {
      counters = List.copyOf(counters);
    }
  }

  private final List<HardwareBlockView> blocks;

  private HardwareView(List<HardwareBlockView> blocks) { this.blocks = List.copyOf(blocks); }

  /**
   * Projects an indexed view onto the bank 0 blocks of a hardware layout.
   * @param layout the product hardware layout
   * @param view the product view
   * @return the hardware view
   * @throws SpecConsistencyException if a layout slot has no counter in the view
   */
  public static HardwareView build(HardwareLayout layout, IndexedView view) {
    List<HardwareBlockView> blocks = new ArrayList<>();
    for (HardwareBlockLayout block : layout.primaryBlocks().toList()) {
      List<CounterView> counters = new ArrayList<>(block.counters().size());
      for (HardwareCounterLayout slot : block.counters()) {
        counters.add(view.getBySourceName(slot.name()).orElseThrow(
            () -> new SpecConsistencyException("Hardware slot " + slot.name() + " of " + layout.databaseKey() + " has no counter entry")));
      }
      if (!counters.isEmpty())
        blocks.add(new HardwareBlockView(block.type(), counters));
    }
    return new HardwareView(blocks);
  }

  public List<HardwareBlockView> blocks() { return blocks; }

  public Stream<CounterView> counters() { return blocks.stream().flatMap(block -> block.counters().stream()); }

  /**
   * Creates a filtered copy, dropping blocks left empty.
   * @param maxVisibility the highest visibility level kept
   * @param allowDerived whether derived counters are kept
   * @return the filtered view
   */
  public HardwareView filter(CounterVisibility maxVisibility, boolean allowDerived) {
    List<HardwareBlockView> filtered = new ArrayList<>();
    for (HardwareBlockView block : blocks) {
      var counters = block.counters().stream().filter(counter -> IndexedView.isShown(counter, maxVisibility, allowDerived)).toList();
      if (!counters.isEmpty())
        filtered.add(new HardwareBlockView(block.type(), counters));
    }
    return new HardwareView(filtered);
  }
}
