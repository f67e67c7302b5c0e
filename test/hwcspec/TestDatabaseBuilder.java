package hwcspec;

import hwcspec.data.ArchitectureInfos;
import hwcspec.data.CounterDefinition;
import hwcspec.data.CounterInfo;
import hwcspec.data.CounterInfos;
import hwcspec.data.CounterTrend;
import hwcspec.data.CounterVisibility;
import hwcspec.data.HardwareBlockLayout;
import hwcspec.data.HardwareBlockType;
import hwcspec.data.HardwareCounterLayout;
import hwcspec.data.HardwareLayout;
import hwcspec.data.HardwareLayouts;
import hwcspec.data.ProductArchitecture;
import hwcspec.data.ProductInfo;
import hwcspec.data.ProductInfos;
import hwcspec.data.ProductVisibility;
import hwcspec.data.SemanticInfo;
import hwcspec.data.SemanticInfos;
import hwcspec.data.SemanticLayout;
import hwcspec.data.SpecDatabase;
import hwcspec.equation.EquationParser;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Builds small in-memory specification databases for tests.
 * Every counter lands in the group set by the last {@link #group(String)} call, with its machine name as group human name,
 * and supports all products unless restricted with {@link #onlyFor(String...)}.
 * The presentation layout is generated from the counters: one section holding all groups.
 */
public class TestDatabaseBuilder {
  public static final String SECTION = "Counters";

  private record CounterSpec(String machineName, OptionalInt stableId, String groupName, String units, CounterVisibility visibility,
                             CounterDefinition definition, List<String> gpuSupport) {}

  private final List<ProductInfo> products = new ArrayList<>();
  private final LinkedHashMap<String, List<HardwareBlockLayout>> blocks = new LinkedHashMap<>();
  private final List<CounterSpec> counters = new ArrayList<>();
  private final Set<String> hiddenFromLayout = new HashSet<>();
  private final LinkedHashMap<String, List<String>> extraLayoutCounters = new LinkedHashMap<>();
  private String groupName = "Activity";

  public TestDatabaseBuilder product(String name, String... features) {
    ProductInfo product = new ProductInfo(List.of(products.size() + 1), List.of(name), 2020, ProductArchitecture.VALHALL, ProductVisibility.PUBLIC);
    product.setFeatures(List.of(features));
    products.add(product);
    blocks.putIfAbsent(name, new ArrayList<>());
    return this;
  }

  /** Adds a bank 0 block to the hardware layout of a product, with slots numbered from 0. */
  public TestDatabaseBuilder block(String databaseKey, HardwareBlockType type, String... sourceNames) {
    List<HardwareCounterLayout> slots = new ArrayList<>();
    for (int i = 0; i < sourceNames.length; ++i)
      slots.add(new HardwareCounterLayout(sourceNames[i], i, 0));
    blocks.computeIfAbsent(databaseKey, key -> new ArrayList<>()).add(new HardwareBlockLayout(type, 0, slots));
    return this;
  }

  public TestDatabaseBuilder group(String groupName) {
    this.groupName = groupName;
    return this;
  }

  public TestDatabaseBuilder nativeCounter(String machineName, Integer stableId, String sourceName) {
    return add(machineName, stableId, "cycles", CounterVisibility.NOVICE, new CounterDefinition.Hardware(sourceName, List.of()));
  }

  public TestDatabaseBuilder derivedCounter(String machineName, Integer stableId, String equation) {
    return derivedCounter(machineName, stableId, equation, "cycles");
  }

  public TestDatabaseBuilder derivedCounter(String machineName, Integer stableId, String equation, String units) {
    return add(machineName, stableId, units, CounterVisibility.NOVICE, new CounterDefinition.Equation(EquationParser.tryParse(equation)));
  }

  private TestDatabaseBuilder add(String machineName, Integer stableId, String units, CounterVisibility visibility, CounterDefinition definition) {
    counters.add(new CounterSpec(machineName, stableId == null ? OptionalInt.empty() : OptionalInt.of(stableId), groupName, units, visibility,
                                 definition, null));
    return this;
  }

  /** Sets the visibility of the last added counter. */
  public TestDatabaseBuilder visibility(CounterVisibility visibility) {
    CounterSpec last = counters.remove(counters.size() - 1);
    counters.add(new CounterSpec(last.machineName(), last.stableId(), last.groupName(), last.units(), visibility, last.definition(),
                                 last.gpuSupport()));
    return this;
  }

  /** Restricts the last added counter to some products. */
  public TestDatabaseBuilder onlyFor(String... gpus) {
    CounterSpec last = counters.remove(counters.size() - 1);
    counters.add(new CounterSpec(last.machineName(), last.stableId(), last.groupName(), last.units(), last.visibility(), last.definition(),
                                 List.of(gpus)));
    return this;
  }

  /** Leaves a counter out of the generated presentation layout. */
  public TestDatabaseBuilder hideFromLayout(String machineName) {
    hiddenFromLayout.add(machineName);
    return this;
  }

  /** Adds a presentation layout counter without a counter entry. */
  public TestDatabaseBuilder extraLayoutCounter(String group, String name) {
    extraLayoutCounters.computeIfAbsent(group, key -> new ArrayList<>()).add(name);
    return this;
  }

  public SpecDatabase build() {
    ProductInfos productInfos = new ProductInfos();
    products.forEach(productInfos::add);
    productInfos.linkDocumentNames();
    List<String> allKeys = productInfos.getDatabaseKeys();

    CounterInfos counterInfos = new CounterInfos();
    LinkedHashMap<String, LinkedHashSet<String>> groups = new LinkedHashMap<>();
    for (CounterSpec spec : counters) {
      counterInfos.add(new CounterInfo("test.yaml", spec.machineName(), spec.stableId(), spec.machineName() + " count", spec.groupName(),
                                       spec.machineName(), "Short description.", "Long description.", spec.units(), CounterTrend.INFORMATIVE,
                                       spec.visibility(), spec.definition(), spec.gpuSupport() == null ? allKeys : spec.gpuSupport()));
      var groupCounters = groups.computeIfAbsent(spec.groupName(), key -> new LinkedHashSet<>());
      if (!hiddenFromLayout.contains(spec.machineName()))
        groupCounters.add(spec.machineName());
    }
    extraLayoutCounters.forEach((group, names) -> groups.computeIfAbsent(group, key -> new LinkedHashSet<>()).addAll(names));

    HardwareLayouts layouts = new HardwareLayouts();
    blocks.forEach((key, keyBlocks) -> layouts.add(new HardwareLayout(key, keyBlocks)));

    SemanticLayout layout = new SemanticLayout();
    SemanticInfos sectionInfos = new SemanticInfos();
    SemanticInfos groupInfos = new SemanticInfos();
    List<SemanticLayout.Group> layoutGroups = new ArrayList<>();
    for (Map.Entry<String, LinkedHashSet<String>> group : groups.entrySet()) {
      layoutGroups.add(new SemanticLayout.Group(group.getKey(), group.getValue().stream().map(SemanticLayout.Counter::new).toList()));
      groupInfos.add(new SemanticInfo(group.getKey(), "Counters of group " + group.getKey() + ".", List.of()));
    }
    layout.append(new SemanticLayout.Section(SECTION, layoutGroups));
    sectionInfos.add(new SemanticInfo(SECTION, "All counters.", List.of()));

    return new SpecDatabase(productInfos, new ArchitectureInfos(), counterInfos, layouts, layout, sectionInfos, groupInfos);
  }

  public HWCSpec buildSpec() { return new HWCSpec(build()); }
}
