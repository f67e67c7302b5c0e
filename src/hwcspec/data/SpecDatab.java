package hwcspec.data;

import hwcspec.equation.EquationParser;
import hwcspec.equation.ParsedEquation;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the raw databases from a database directory.
 *
 * <pre>
 * products.yaml          list of products
 * architectures.yaml     list of architecture documentation entries
 * counters/*.yaml        lists of counter entries, loaded in file name order
 * hardware/*.yaml        one hardware layout per database key
 * semantic-layout.yaml   sections, groups and counters in presentation order
 * section-info.yaml      section documentation entries
 * group-info.yaml        group documentation entries
 * </pre>
 */
public class SpecDatab {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String PRODUCTS_FILE = "products.yaml";
  public static final String ARCHITECTURES_FILE = "architectures.yaml";
  public static final String COUNTERS_DIR = "counters";
  public static final String HARDWARE_DIR = "hardware";
  public static final String SEMANTIC_LAYOUT_FILE = "semantic-layout.yaml";
  public static final String SECTION_INFO_FILE = "section-info.yaml";
  public static final String GROUP_INFO_FILE = "group-info.yaml";

  private final File root;

  public SpecDatab(File root) { this.root = root; }

  public File getRoot() { return root; }

  /**
   * Reads all databases below the root directory.
   * @return the loaded databases
   * @throws SpecFormatException if a file is missing, unreadable or malformed
   */
  public SpecDatabase load() throws SpecFormatException {
    if (!root.isDirectory())
      throw new SpecFormatException("Database directory not found: " + root);
    logger.info("Loading counter specification from {}", root);

    ProductInfos products = readProducts(new File(root, PRODUCTS_FILE));
    ArchitectureInfos architectures = readArchitectures(new File(root, ARCHITECTURES_FILE));
    CounterInfos counters = new CounterInfos();
    for (File file : listYaml(new File(root, COUNTERS_DIR)))
      counters.addAll(readCounters(file));
    HardwareLayouts layouts = new HardwareLayouts();
    for (File file : listYaml(new File(root, HARDWARE_DIR)))
      layouts.add(readHardwareLayout(file));
    SemanticLayout semanticLayout = readSemanticLayout(new File(root, SEMANTIC_LAYOUT_FILE));
    SemanticInfos sectionInfos = readSemanticInfos(new File(root, SECTION_INFO_FILE));
    SemanticInfos groupInfos = readSemanticInfos(new File(root, GROUP_INFO_FILE));

    logger.debug("Loaded {} products, {} counter entries, {} hardware layouts", products.products().size(), counters.size(),
                 layouts.layouts().size());
    return new SpecDatabase(products, architectures, counters, layouts, semanticLayout, sectionInfos, groupInfos);
  }

  private static List<File> listYaml(File dir) throws SpecFormatException {
    File[] files = dir.listFiles((parent, name) -> name.endsWith(".yaml"));
    if (files == null)
      throw new SpecFormatException("Database directory not found: " + dir);
    Arrays.sort(files, Comparator.comparing(File::getName));
    return Arrays.asList(files);
  }

  static Object loadYaml(File file) throws SpecFormatException {
    try (InputStream readFile = new FileInputStream(file)) {
      return new Yaml().load(readFile);
    } catch (IOException e) {
      throw new SpecFormatException("Cannot read " + file, e);
    } catch (YAMLException e) {
      throw new SpecFormatException("Malformed YAML in " + file + ": " + e.getMessage(), e);
    }
  }

  private static List<Entry> loadEntryList(File file) throws SpecFormatException {
    Object parseResult = loadYaml(file);
    if (parseResult == null)
      return List.of();
    if (!(parseResult instanceof List<?> list))
      throw new SpecFormatException("Expected a list of entries in " + file.getName());
    List<Entry> ret = new ArrayList<>(list.size());
    for (int i = 0; i < list.size(); ++i) {
      String context = file.getName() + " entry " + (i + 1);
      if (!(list.get(i) instanceof Map<?, ?> map))
        throw new SpecFormatException("Expected a mapping in " + context);
      ret.add(new Entry(map, context));
    }
    return ret;
  }

  /** A YAML mapping together with a description of where it came from. */
  static class Entry {
    private final Map<?, ?> map;
    private final String context;

    Entry(Map<?, ?> map, String context) {
      this.map = map;
      this.context = context;
    }

    String getContext() { return context; }

    SpecFormatException error(String message) { return new SpecFormatException(context + ": " + message); }

    boolean has(String key) { return map.get(key) != null; }

    Optional<String> optString(String key) throws SpecFormatException {
      Object value = map.get(key);
      if (value == null)
        return Optional.empty();
      if (value instanceof String || value instanceof Number)
        return Optional.of(value.toString());
      throw error("Field '" + key + "' must be a string");
    }

    String getString(String key) throws SpecFormatException {
      return optString(key).orElseThrow(() -> error("Missing field '" + key + "'"));
    }

    OptionalInt optInt(String key) throws SpecFormatException {
      Object value = map.get(key);
      if (value == null)
        return OptionalInt.empty();
      if (value instanceof Integer intValue)
        return OptionalInt.of(intValue);
      if (value instanceof String strValue) {
        try {
          return OptionalInt.of(strValue.startsWith("0x") ? Integer.parseInt(strValue.substring(2), 16) : Integer.parseInt(strValue));
        } catch (NumberFormatException e) {
          throw error("Field '" + key + "' is not an integer: " + strValue);
        }
      }
      throw error("Field '" + key + "' must be an integer");
    }

    int getInt(String key) throws SpecFormatException {
      OptionalInt ret = optInt(key);
      if (ret.isEmpty())
        throw error("Missing field '" + key + "'");
      return ret.getAsInt();
    }

    List<String> getStringList(String key) throws SpecFormatException {
      Object value = map.get(key);
      if (value == null)
        return List.of();
      if (!(value instanceof List<?> list))
        throw error("Field '" + key + "' must be a list");
      List<String> ret = new ArrayList<>(list.size());
      for (Object item : list) {
        if (!(item instanceof String || item instanceof Number))
          throw error("Field '" + key + "' must only contain strings");
        ret.add(item.toString());
      }
      return ret;
    }

    List<Entry> getEntryList(String key) throws SpecFormatException {
      Object value = map.get(key);
      if (value == null)
        return List.of();
      if (!(value instanceof List<?> list))
        throw error("Field '" + key + "' must be a list");
      List<Entry> ret = new ArrayList<>(list.size());
      for (int i = 0; i < list.size(); ++i) {
        if (!(list.get(i) instanceof Map<?, ?> itemMap))
          throw error("Field '" + key + "' must only contain mappings");
        ret.add(new Entry(itemMap, context + ", " + key + " " + (i + 1)));
      }
      return ret;
    }
  }

  ProductInfos readProducts(File file) throws SpecFormatException {
    ProductInfos ret = new ProductInfos();
    for (Entry entry : loadEntryList(file)) {
      List<Integer> ids = new ArrayList<>();
      Object rawIds = entry.map.get("ids");
      if (!(rawIds instanceof List<?> idList) || idList.isEmpty())
        throw entry.error("Missing field 'ids'");
      for (int i = 0; i < idList.size(); ++i)
        ids.add(new Entry(Map.of("id", idList.get(i)), entry.context).getInt("id"));

      String architectureName = entry.getString("architecture");
      ProductArchitecture architecture =
          ProductArchitecture.fromSerialName(architectureName).orElseThrow(() -> entry.error("Unknown architecture '" + architectureName + "'"));
      String visibilityName = entry.getString("visibility");
      ProductVisibility visibility =
          ProductVisibility.fromSerialName(visibilityName).orElseThrow(() -> entry.error("Unknown visibility '" + visibilityName + "'"));
      List<String> names = entry.getStringList("names");
      if (names.isEmpty())
        throw entry.error("Missing field 'names'");

      ProductInfo product = new ProductInfo(ids, names, entry.getInt("release_year"), architecture, visibility);
      entry.optString("database_key").ifPresent(product::setDatabaseKey);
      Object documentName = entry.map.get("document_name");
      if (Boolean.FALSE.equals(documentName))
        product.setDocumentName(Optional.empty());
      else if (documentName != null)
        product.setDocumentName(Optional.of(documentName.toString()));
      product.setFeatures(entry.getStringList("features"));
      product.setEngineeringName(entry.optString("engineering_name"));
      product.setProjectName(entry.optString("project_name"));
      product.setArchitectureBranch(entry.optString("architecture_branch"));
      ret.add(product);
    }
    ret.linkDocumentNames();
    return ret;
  }

  ArchitectureInfos readArchitectures(File file) throws SpecFormatException {
    ArchitectureInfos ret = new ArchitectureInfos();
    if (!file.exists()) {
      logger.debug("No architecture documentation in {}", root);
      return ret;
    }
    for (Entry entry : loadEntryList(file)) {
      String name = entry.getString("name");
      ProductArchitecture architecture =
          ProductArchitecture.fromSerialName(name).orElseThrow(() -> entry.error("Unknown architecture '" + name + "'"));
      ret.add(new ArchitectureInfo(architecture, entry.optString("long_description").orElse(""), entry.getStringList("gpu_support")));
    }
    return ret;
  }

  List<CounterInfo> readCounters(File file) throws SpecFormatException {
    List<CounterInfo> ret = new ArrayList<>();
    for (Entry entry : loadEntryList(file))
      ret.add(readCounter(entry, file.getName()));
    return ret;
  }

  static CounterInfo readCounter(Entry entry, String sourceFile) throws SpecFormatException {
    String trendName = entry.getString("trend");
    CounterTrend trend = CounterTrend.fromSerialName(trendName).orElseThrow(() -> entry.error("Unknown trend '" + trendName + "'"));
    String visibilityName = entry.getString("visibility");
    CounterVisibility visibility =
        CounterVisibility.fromSerialName(visibilityName).orElseThrow(() -> entry.error("Unknown visibility '" + visibilityName + "'"));

    Optional<String> source = entry.optString("source");
    Optional<String> equation = entry.optString("equation");
    if (source.isPresent() == equation.isPresent())
      throw entry.error("A counter needs exactly one of 'source' and 'equation'");
    CounterDefinition definition;
    if (source.isPresent()) {
      definition = new CounterDefinition.Hardware(source.get(), entry.getStringList("aliases"));
    } else {
      if (entry.has("aliases"))
        throw entry.error("Derived counters cannot have source aliases");
      ParsedEquation parsed = EquationParser.tryParse(equation.get().strip());
      parsed.error().ifPresent(error -> logger.debug("{}: {}", entry.getContext(), error));
      definition = new CounterDefinition.Equation(parsed);
    }

    return new CounterInfo(sourceFile, entry.getString("machine_name"), entry.optInt("stable_id"), entry.getString("human_name"),
                           entry.getString("group_name"), entry.getString("group_human_name"), entry.optString("short_description").orElse(""),
                           entry.optString("long_description").orElse(""), entry.getString("units"), trend, visibility, definition,
                           entry.getStringList("gpu_support"));
  }

  HardwareLayout readHardwareLayout(File file) throws SpecFormatException {
    Object parseResult = loadYaml(file);
    if (!(parseResult instanceof Map<?, ?> map))
      throw new SpecFormatException("Expected a mapping in " + file.getName());
    Entry layoutEntry = new Entry(map, file.getName());
    String databaseKey = layoutEntry.optString("database_key").orElse(file.getName().replaceFirst("\\.yaml$", ""));

    List<HardwareBlockLayout> blocks = new ArrayList<>();
    for (Entry blockEntry : layoutEntry.getEntryList("blocks")) {
      String typeName = blockEntry.getString("type");
      HardwareBlockType type =
          HardwareBlockType.fromSerialName(typeName).orElseThrow(() -> blockEntry.error("Unknown block type '" + typeName + "'"));
      List<HardwareCounterLayout> counters = new ArrayList<>();
      List<Entry> counterEntries = blockEntry.getEntryList("counters");
      for (int i = 0; i < counterEntries.size(); ++i) {
        Entry counterEntry = counterEntries.get(i);
        try {
          counters.add(new HardwareCounterLayout(counterEntry.getString("name"), counterEntry.optInt("index").orElse(i),
                                                 counterEntry.optInt("shift").orElse(0)));
        } catch (IllegalArgumentException e) {
          throw counterEntry.error(e.getMessage());
        }
      }
      blocks.add(new HardwareBlockLayout(type, blockEntry.optInt("bank").orElse(0), counters));
    }
    return new HardwareLayout(databaseKey, blocks);
  }

  /** Reads the single-key mapping {@code name: [children]} used by the semantic layout file. */
  private static Map.Entry<String, List<?>> readLayoutNode(Object node, String context) throws SpecFormatException {
    if (!(node instanceof Map<?, ?> map) || map.size() != 1)
      throw new SpecFormatException(context + ": expected a single 'name: [...]' mapping");
    Map.Entry<?, ?> item = map.entrySet().iterator().next();
    Object children = item.getValue();
    if (children != null && !(children instanceof List<?>))
      throw new SpecFormatException(context + ": children of '" + item.getKey() + "' must be a list");
    return Map.entry(String.valueOf(item.getKey()), children == null ? List.of() : (List<?>)children);
  }

  SemanticLayout readSemanticLayout(File file) throws SpecFormatException {
    Object parseResult = loadYaml(file);
    SemanticLayout ret = new SemanticLayout();
    if (parseResult == null)
      return ret;
    if (!(parseResult instanceof List<?> sections))
      throw new SpecFormatException("Expected a list of sections in " + file.getName());
    for (Object sectionNode : sections) {
      var section = readLayoutNode(sectionNode, file.getName());
      List<SemanticLayout.Group> groups = new ArrayList<>();
      for (Object groupNode : section.getValue()) {
        var group = readLayoutNode(groupNode, file.getName() + ", section " + section.getKey());
        List<SemanticLayout.Counter> counters = new ArrayList<>();
        for (Object counterName : group.getValue()) {
          if (!(counterName instanceof String))
            throw new SpecFormatException(file.getName() + ", group " + group.getKey() + ": counter entries must be names");
          counters.add(new SemanticLayout.Counter((String)counterName));
        }
        groups.add(new SemanticLayout.Group(group.getKey(), counters));
      }
      ret.append(new SemanticLayout.Section(section.getKey(), groups));
    }
    return ret;
  }

  SemanticInfos readSemanticInfos(File file) throws SpecFormatException {
    SemanticInfos ret = new SemanticInfos();
    for (Entry entry : loadEntryList(file))
      ret.add(new SemanticInfo(entry.getString("name"), entry.optString("long_description").orElse(""), entry.getStringList("gpu_support")));
    return ret;
  }
}
