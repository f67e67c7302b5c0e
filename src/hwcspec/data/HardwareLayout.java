package hwcspec.data;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Hardware counter memory layout shared by all products with the same database key.
 */
public record HardwareLayout(String databaseKey, List<HardwareBlockLayout> blocks) {

  /** A slot together with the block that contains it. */
  public record Lookup(HardwareBlockLayout block, HardwareCounterLayout counter) {}

  public HardwareLayout {
    blocks = List.copyOf(blocks);
  }

  /**
   * Finds a slot by hardware name, searching blocks in layout order.
   * @param name the hardware source name
   * @return the first matching slot
   */
  public Optional<Lookup> getCounterByName(String name) {
    for (HardwareBlockLayout block : blocks) {
      for (HardwareCounterLayout counter : block.counters()) {
        if (counter.name().equals(name))
          return Optional.of(new Lookup(block, counter));
      }
    }
    return Optional.empty();
  }

  /** @return the blocks that feed hardware views */
  public Stream<HardwareBlockLayout> primaryBlocks() { return blocks.stream().filter(block -> block.bank() == 0); }

  /** @return all slots of the primary blocks, in layout order */
  public Stream<Lookup> counters() {
    return primaryBlocks().flatMap(block -> block.counters().stream().map(counter -> new Lookup(block, counter)));
  }
}
