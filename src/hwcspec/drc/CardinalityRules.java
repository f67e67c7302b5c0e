package hwcspec.drc;

import hwcspec.data.HardwareBlockType;
import java.util.Map;
import java.util.Set;

/**
 * Rules for the cardinality check of derived equations.
 * An equation combining counters of several domains must divide every non-{@link CardinalityDomain#GPU} domain
 * by its instance count, given by a scaling constant.
 * @param domains the domain of each block type
 * @param scalingConstants the constants giving the instance count of a domain
 * @param ignoredConstants constants without a domain
 * @param exceptions machine names of counters reviewed by hand and not checked
 */
public record CardinalityRules(Map<HardwareBlockType, CardinalityDomain> domains, Map<String, CardinalityDomain> scalingConstants,
                               Set<String> ignoredConstants, Set<String> exceptions) {

  public static final CardinalityRules DEFAULT = new CardinalityRules(
      Map.of(HardwareBlockType.GPU_FRONTEND, CardinalityDomain.GPU, HardwareBlockType.TILER, CardinalityDomain.GPU,
             HardwareBlockType.MEMORY_SYSTEM, CardinalityDomain.MEM, HardwareBlockType.SHADER_CORE, CardinalityDomain.SC),
      Map.of("MALI_CONFIG_L2_CACHE_COUNT", CardinalityDomain.MEM, "MALI_CONFIG_SHADER_CORE_COUNT", CardinalityDomain.SC),
      Set.of("MALI_CONFIG_TIME_SPAN", "MALI_CONFIG_EXT_BUS_BYTE_SIZE"),
      Set.of("MaliFragOverdraw", "MaliSCBusTileWrBPerPx"));

  public CardinalityRules {
    domains = Map.copyOf(domains);
    scalingConstants = Map.copyOf(scalingConstants);
    ignoredConstants = Set.copyOf(ignoredConstants);
    exceptions = Set.copyOf(exceptions);
  }

  /**
   * Creates a copy with a different set of reviewed exceptions.
   * @param exceptions machine names not checked
   * @return the new rules
   */
  public CardinalityRules withExceptions(Set<String> exceptions) {
    return new CardinalityRules(domains, scalingConstants, ignoredConstants, exceptions);
  }
}
