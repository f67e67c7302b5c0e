package hwcspec.view;

import hwcspec.data.HardwareBlockType;
import hwcspec.equation.EquationNode;
import hwcspec.equation.ParsedEquation;
import java.util.Optional;

/**
 * Where the value of a compiled counter comes from.
 */
public sealed interface CounterSource permits CounterSource.Native, CounterSource.Derived {

  /**
   * Counter read from a hardware slot.
   * @param sourceName the hardware name matched for this product
   * @param blockType the block holding the slot; empty if no layout slot matched, which validation reports
   * @param blockIndex slot index inside the block
   * @param scaleMultiplier multiplier reconstructing the full-precision value
   */
  record Native(String sourceName, Optional<HardwareBlockType> blockType, int blockIndex, int scaleMultiplier) implements CounterSource {}

  /** Counter computed from an equation. */
  record Derived(ParsedEquation equation) implements CounterSource {
    public Optional<EquationNode> ast() { return equation.ast(); }
  }
}
