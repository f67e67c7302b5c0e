package hwcspec.equation;

import hwcspec.view.CounterView;
import hwcspec.view.IndexedView;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renames a resolved tree into the Streamline expression dialect.
 * <p>
 * Counter names are derived from the group name and the group human name,
 * so all Streamline assets must be generated from the same database revision.
 */
public class StreamlineNameRenamer extends EquationRewriter<RuntimeException> {
  private static final Pattern WORD_SEPARATOR = Pattern.compile("[^_A-Za-z0-9]+");

  /** Streamline spelling of the product constants. */
  public static final Map<String, String> CONSTANT_NAMES = Map.of(
      "MALI_CONFIG_TIME_SPAN", "$ZOOM",
      "MALI_CONFIG_L2_CACHE_COUNT", "$MaliConstantsL2SliceCount",
      "MALI_CONFIG_SHADER_CORE_COUNT", "$MaliConstantsShaderCoreCount",
      "MALI_CONFIG_EXT_BUS_BYTE_SIZE", "($MaliConstantsBusWidthBits / 8)");

  private final IndexedView view;

  public StreamlineNameRenamer(IndexedView view) { this.view = view; }

  /**
   * Builds the Streamline variable name of a counter.
   * @param counter the counter
   * @return the mangled name, e.g. {@code $MaliGPUCyclesGPUActive}
   */
  public static String mangleCounterName(CounterView counter) {
    StringBuilder name = new StringBuilder();
    for (String part : WORD_SEPARATOR.split(counter.getGroupName() + " " + counter.getGroupHumanName())) {
      if (part.isEmpty())
        continue;
      name.append(Character.toUpperCase(part.charAt(0))).append(part, 1, part.length());
    }
    if (name.length() > 0 && Character.isDigit(name.charAt(0)))
      name.insert(0, '_');
    return "$Mali" + name;
  }

  /**
   * Looks up the Streamline spelling of a constant.
   * @param constant the constant name
   * @return the Streamline name or expression
   * @throws UnmappedConstantException if the constant has no Streamline spelling
   */
  public static String mangleConstantName(String constant) {
    String ret = CONSTANT_NAMES.get(constant);
    if (ret == null)
      throw new UnmappedConstantException(constant);
    return ret;
  }

  @Override
  public EquationNode visitName(NameNode node) {
    if (EquationResolver.isConstant(node.name()))
      return new NameNode(mangleConstantName(node.name()));
    CounterView counter =
        view.getByMachineName(node.name()).orElseThrow(() -> new IllegalStateException("Unknown counter in resolved equation: " + node.name()));
    return new NameNode(mangleCounterName(counter));
  }
}
