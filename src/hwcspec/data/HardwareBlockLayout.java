package hwcspec.data;

import java.util.List;

/**
 * One hardware counter block.
 * Bank 0 holds the primary copy of a block, other banks repeat it.
 */
public record HardwareBlockLayout(HardwareBlockType type, int bank, List<HardwareCounterLayout> counters) {
  public HardwareBlockLayout {
    counters = List.copyOf(counters);
  }
}
