package hwcspec.data;

/**
 * One counter slot in a hardware block.
 * @param name the hardware source name
 * @param index the slot index inside the block
 * @param shift log2 of the multiplier that reconstructs the full-precision value from the saturating hardware counter
 */
public record HardwareCounterLayout(String name, int index, int shift) {
  public HardwareCounterLayout {
    if (index < 0 || shift < 0 || shift > 30)
      throw new IllegalArgumentException("Invalid slot " + name + ": index " + index + ", shift " + shift);
  }

  public int scaleMultiplier() { return 1 << shift; }
}
