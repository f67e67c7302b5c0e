package hwcspec.drc;

import hwcspec.HWCSpec;
import hwcspec.SpecConsistencyException;
import hwcspec.data.CounterInfo;
import hwcspec.data.HardwareBlockType;
import hwcspec.data.HardwareLayout;
import hwcspec.data.SemanticInfo;
import hwcspec.data.SemanticInfos;
import hwcspec.data.SemanticLayout;
import hwcspec.data.SpecDatabase;
import hwcspec.doc.DocReference;
import hwcspec.doc.DocReferences;
import hwcspec.equation.EquationNode;
import hwcspec.view.CounterView;
import hwcspec.view.IndexedView;
import hwcspec.view.SemanticView;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Design rule checks of a counter specification.
 * <p>
 * Each check can be run on its own and returns its findings as a {@link CheckResult}; findings are logged as errors.
 * A failing check never prevents the others from running.
 * Database-wide checks work on the raw databases, product checks on the compiled views of one database key.
 */
public class SpecDRC {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Maximum length of strings passed to Vulkan, VK_MAX_DESCRIPTION_SIZE without the terminator. */
  public static final int VULKAN_MAX_STRING_LENGTH = 255;

  public static final Set<String> VALID_UNITS = Set.of(
      "percent",
      // usage
      "beats", "cycles", "issues",
      // sizes
      "bits", "bytes",
      // rates
      "bytes/second",
      // things
      "boxes", "blocks", "instances", "instructions", "interrupts", "jobs", "pixels", "primitives", "quads", "requests", "tasks", "tests",
      "tiles", "threads", "transactions", "warps", "batches", "nodes", "triangles", "rays");

  private final HWCSpec spec;
  private CardinalityRules cardinalityRules = CardinalityRules.DEFAULT;

  public SpecDRC(HWCSpec spec) { this.spec = spec; }

  public void setCardinalityRules(CardinalityRules cardinalityRules) { this.cardinalityRules = cardinalityRules; }
  public CardinalityRules getCardinalityRules() { return cardinalityRules; }

  private SpecDatabase database() { return spec.getDatabase(); }

  private static CheckResult report(String name, List<Diagnostic> diagnostics) {
    for (Diagnostic diagnostic : diagnostics)
      logger.error("DRC - {}", diagnostic);
    logger.debug("DRC - {}: {} errors", name, diagnostics.size());
    return new CheckResult(name, diagnostics);
  }

  /**
   * Runs all checks: database-wide checks first, then the product checks for every database key.
   * Stable IDs are assigned before any view is compiled.
   * @return the results of all checks, in execution order
   */
  public List<CheckResult> runAll() {
    List<CheckResult> results = new ArrayList<>();
    results.add(checkWhitespace());
    results.add(checkAbsenceOfReferences());
    results.add(checkVulkanStringLengths());
    results.add(checkStableIds());
    results.add(checkGpuFields());
    results.add(checkUnits());
    results.add(checkEquationParse());
    results.add(checkSemanticLayout());
    results.add(checkSemanticInfo());

    for (String databaseKey : spec.getSupportedDatabaseKeys()) {
      results.add(checkNameUniqueness(databaseKey));
      results.add(guarded("source names", databaseKey, () -> checkSourceNameConsistency(databaseKey)));
      results.add(guarded("equation resolve", databaseKey, () -> checkEquationResolve(databaseKey)));
      results.add(guarded("equation cardinality", databaseKey, () -> checkEquationCardinality(databaseKey)));
      results.add(guarded("counter documentation", databaseKey, () -> checkCounterDocumentation(databaseKey)));
      results.add(guarded("semantic documentation", databaseKey, () -> checkSemanticDocumentation(databaseKey)));
    }
    logger.info("DRC - {} checks run, {} errors", results.size(), CheckResult.totalErrors(results));
    return results;
  }

  private interface ProductCheck {
    CheckResult run();
  }

  // A product whose views cannot be compiled fails the check instead of stopping the run
  private static CheckResult guarded(String name, String databaseKey, ProductCheck check) {
    try {
      return check.run();
    } catch (SpecConsistencyException e) {
      return report(name + " " + databaseKey,
                    List.of(Diagnostic.forProduct(DiagnosticKind.INCONSISTENT_DATABASE, databaseKey, name, "Cannot compile product views",
                                                  e.getMessage())));
    }
  }

  ////////////////////////////// database-wide checks //////////////////////////////

  private static void checkTrimmed(List<Diagnostic> out, String source, String subject, Map<String, String> fields) {
    for (var field : fields.entrySet()) {
      String value = field.getValue();
      if (!value.equals(value.strip()))
        out.add(Diagnostic.of(DiagnosticKind.WHITESPACE, subject, "Pre/post whitespace in " + source, field.getKey()));
      if (value.contains("  "))
        out.add(Diagnostic.of(DiagnosticKind.WHITESPACE, subject, "Double whitespace in " + source, field.getKey()));
    }
  }

  private static Map<String, String> textFields(CounterInfo counter) {
    LinkedHashMap<String, String> fields = new LinkedHashMap<>();
    fields.put("Machine name", counter.getMachineName());
    fields.put("Source name", counter.getSourceName().orElse(""));
    fields.put("Human name", counter.getHumanName());
    fields.put("Group name", counter.getGroupName());
    fields.put("Group human name", counter.getGroupHumanName());
    fields.put("Short description", counter.getShortDescription());
    fields.put("Long description", counter.getLongDescription());
    return fields;
  }

  private static Map<String, String> textFields(SemanticInfo info) {
    LinkedHashMap<String, String> fields = new LinkedHashMap<>();
    fields.put("Name", info.name());
    fields.put("Long description", info.longDescription());
    return fields;
  }

  private static Collection<SemanticInfo> allInfos(SemanticInfos infos) {
    return infos.entries().values().stream().flatMap(List::stream).toList();
  }

  /**
   * Checks text fields of counters and semantic documentation for leading, trailing and double spaces.
   * @return the check result
   */
  public CheckResult checkWhitespace() {
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (CounterInfo counter : database().counters())
      checkTrimmed(diagnostics, "CounterInfo", counter.getMachineName(), textFields(counter));
    for (SemanticInfo section : allInfos(database().sectionInfos()))
      checkTrimmed(diagnostics, "SemanticSectionInfo", section.name(), textFields(section));
    for (SemanticInfo group : allInfos(database().groupInfos()))
      checkTrimmed(diagnostics, "SemanticGroupInfo", group.name(), textFields(group));
    return report("whitespace", diagnostics);
  }

  /**
   * Checks that fields shown verbatim by tools carry no documentation references.
   * @return the check result
   */
  public CheckResult checkAbsenceOfReferences() {
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (CounterInfo counter : database().counters()) {
      Map<String, String> fields = new LinkedHashMap<>();
      fields.put("Human name", counter.getHumanName());
      fields.put("Group name", counter.getGroupName());
      fields.put("Group human name", counter.getGroupHumanName());
      fields.put("Short description", counter.getShortDescription());
      fields.forEach((field, value) -> {
        if (value.contains("{{"))
          diagnostics.add(Diagnostic.of(DiagnosticKind.UNEXPECTED_REFERENCE, counter.getMachineName(), "Counter reference in CounterInfo", field));
      });
    }
    return report("absence of references", diagnostics);
  }

  /**
   * Checks the length of strings that Vulkan drivers expose directly.
   * @return the check result
   */
  public CheckResult checkVulkanStringLengths() {
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (CounterInfo counter : database().counters()) {
      if (counter.getHumanName().length() > VULKAN_MAX_STRING_LENGTH)
        diagnostics.add(Diagnostic.of(DiagnosticKind.FIELD_LENGTH, counter.getMachineName(), "Field too long for Vulkan", "Human name"));
      if (counter.getShortDescription().length() > VULKAN_MAX_STRING_LENGTH)
        diagnostics.add(Diagnostic.of(DiagnosticKind.FIELD_LENGTH, counter.getMachineName(), "Field too long for Vulkan", "Short description"));
    }
    return report("Vulkan string lengths", diagnostics);
  }

  /**
   * Checks that each stable ID belongs to exactly one machine name and vice versa.
   * <p>
   * Entries without a stable ID are assigned one in place: the ID of another entry with the same machine name if there is one,
   * else the lowest unused ID. Every assignment is reported, so a database needing assignments never passes;
   * running the check again after assigning finds nothing more to assign.
   * @return the check result
   */
  public CheckResult checkStableIds() {
    List<Diagnostic> diagnostics = new ArrayList<>();
    HashMap<Integer, CounterInfo> foundIds = new HashMap<>();
    HashMap<String, CounterInfo> foundNames = new HashMap<>();
    LinkedHashMap<String, List<CounterInfo>> missingIds = new LinkedHashMap<>();

    for (CounterInfo counter : database().counters()) {
      String machineName = counter.getMachineName();
      if (counter.getStableId().isEmpty()) {
        missingIds.computeIfAbsent(machineName, name -> new ArrayList<>()).add(counter);
        continue;
      }
      int stableId = counter.getStableId().getAsInt();

      CounterInfo idOwner = foundIds.putIfAbsent(stableId, counter);
      if (idOwner != null && !idOwner.getMachineName().equals(machineName)) {
        diagnostics.add(Diagnostic.of(DiagnosticKind.STABLE_ID_CONFLICT, machineName, "Stable ID reused for a different Machine Name",
                                      stableId + " used by " + idOwner.getMachineName()));
      }
      CounterInfo nameOwner = foundNames.putIfAbsent(machineName, counter);
      if (nameOwner != null && nameOwner.getStableId().getAsInt() != stableId) {
        diagnostics.add(Diagnostic.of(DiagnosticKind.STABLE_ID_CONFLICT, machineName, "Machine Name alias using a different Stable ID",
                                      stableId + " vs " + nameOwner.getStableId().getAsInt()));
      }
    }

    for (var missing : missingIds.entrySet()) {
      CounterInfo named = foundNames.get(missing.getKey());
      int stableId = (named != null) ? named.getStableId().getAsInt() : lowestUnusedId(foundIds.keySet());
      for (CounterInfo counter : missing.getValue()) {
        counter.setStableId(stableId);
        diagnostics.add(Diagnostic.of(DiagnosticKind.STABLE_ID_MISSING, counter.getMachineName(), "Missing stable ID", "suggest " + stableId));
      }
      foundIds.putIfAbsent(stableId, missing.getValue().get(0));
      foundNames.putIfAbsent(missing.getKey(), missing.getValue().get(0));
    }
    if (!missingIds.isEmpty())
      spec.clearCache();
    return report("stable IDs", diagnostics);
  }

  static int lowestUnusedId(Set<Integer> used) {
    int max = used.stream().mapToInt(Integer::intValue).max().orElse(-1);
    for (int i = 0; i <= max + 1; ++i) {
      if (!used.contains(i))
        return i;
    }
    return max + 1;
  }

  /**
   * Checks that counters and semantic documentation only name known database keys.
   * @return the check result
   */
  public CheckResult checkGpuFields() {
    List<Diagnostic> diagnostics = new ArrayList<>();
    Set<String> keys = new HashSet<>(spec.getSupportedDatabaseKeys());
    for (CounterInfo counter : database().counters()) {
      counter.getGpuSupport().stream().filter(gpu -> !keys.contains(gpu)).forEach(
          gpu -> diagnostics.add(Diagnostic.forProduct(DiagnosticKind.BAD_GPU, gpu, counter.getMachineName(), "Bad GPU for CounterInfo")));
    }
    for (SemanticInfo section : allInfos(database().sectionInfos())) {
      section.gpuSupport().stream().filter(gpu -> !keys.contains(gpu)).forEach(
          gpu -> diagnostics.add(Diagnostic.forProduct(DiagnosticKind.BAD_GPU, gpu, section.name(), "Bad GPU for SemanticSectionInfo")));
    }
    for (SemanticInfo group : allInfos(database().groupInfos())) {
      group.gpuSupport().stream().filter(gpu -> !keys.contains(gpu)).forEach(
          gpu -> diagnostics.add(Diagnostic.forProduct(DiagnosticKind.BAD_GPU, gpu, group.name(), "Bad GPU for SemanticGroupInfo")));
    }
    return report("GPU fields", diagnostics);
  }

  /**
   * Checks that every counter uses a known unit.
   * @return the check result
   */
  public CheckResult checkUnits() {
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (CounterInfo counter : database().counters()) {
      if (!VALID_UNITS.contains(counter.getUnits()))
        diagnostics.add(Diagnostic.of(DiagnosticKind.BAD_UNITS, counter.getMachineName(), "Bad units for CounterInfo", counter.getUnits()));
    }
    return report("units", diagnostics);
  }

  /**
   * Checks that all equations parsed.
   * @return the check result
   */
  public CheckResult checkEquationParse() {
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (CounterInfo counter : database().counters()) {
      counter.getEquation().flatMap(equation -> equation.error()).ifPresent(
          error -> diagnostics.add(Diagnostic.of(DiagnosticKind.EQUATION_PARSE, counter.getMachineName(), "Bad equation for CounterInfo",
                                                 error.toString())));
    }
    return report("equation parse", diagnostics);
  }

  private static class GroupUsage {
    final String section;
    final Set<String> layoutCounters = new LinkedHashSet<>();
    final Set<String> databaseCounters = new LinkedHashSet<>();
    int entries = 0;

    GroupUsage(String section) { this.section = section; }
  }

  /**
   * Checks that the presentation layout and the counter database describe the same groups and counters.
   * Layout counters are matched against the group human names of counter entries.
   * Duplicate names in the layout stop the check early, since they make all later findings unreliable.
   * @return the check result
   */
  public CheckResult checkSemanticLayout() {
    List<Diagnostic> diagnostics = new ArrayList<>();
    LinkedHashMap<String, Integer> sections = new LinkedHashMap<>();
    LinkedHashMap<String, GroupUsage> groups = new LinkedHashMap<>();

    for (SemanticLayout.Section section : database().semanticLayout().sections()) {
      if (sections.containsKey(section.name()))
        diagnostics.add(Diagnostic.of(DiagnosticKind.LAYOUT_DUPLICATE, section.name(), "Duplicate section in SemanticLayout"));
      sections.put(section.name(), 0);
      for (SemanticLayout.Group group : section.groups()) {
        if (groups.containsKey(group.name()))
          diagnostics.add(Diagnostic.of(DiagnosticKind.LAYOUT_DUPLICATE, group.name(), "Duplicate group in SemanticLayout"));
        GroupUsage usage = new GroupUsage(section.name());
        groups.put(group.name(), usage);
        for (SemanticLayout.Counter counter : group.counters()) {
          if (!usage.layoutCounters.add(counter.name()))
            diagnostics.add(Diagnostic.of(DiagnosticKind.LAYOUT_DUPLICATE, group.name() + "." + counter.name(), "Duplicate counter in SemanticLayout"));
        }
      }
    }
    if (!diagnostics.isEmpty())
      return report("semantic layout", diagnostics);

    for (CounterInfo counter : database().counters()) {
      GroupUsage usage = groups.get(counter.getGroupName());
      if (usage == null) {
        diagnostics.add(Diagnostic.of(DiagnosticKind.LAYOUT_MISSING_GROUP, counter.getGroupName(), "Missing group in SemanticLayout",
                                      counter.getMachineName()));
        continue;
      }
      usage.entries++;
      usage.databaseCounters.add(counter.getGroupHumanName());
      sections.merge(usage.section, 1, Integer::sum);
    }

    sections.forEach((name, entries) -> {
      if (entries == 0)
        diagnostics.add(Diagnostic.of(DiagnosticKind.LAYOUT_EXTRA_SECTION, name, "Extra section in SemanticLayout"));
    });
    groups.forEach((name, usage) -> {
      if (usage.entries == 0)
        diagnostics.add(Diagnostic.of(DiagnosticKind.LAYOUT_EXTRA_GROUP, name, "Extra group in SemanticLayout"));
      for (String counter : usage.layoutCounters) {
        if (!usage.databaseCounters.contains(counter))
          diagnostics.add(Diagnostic.of(DiagnosticKind.LAYOUT_EXTRA_COUNTER, name + "." + counter, "Extra semantic counter in SemanticLayout"));
      }
      for (String counter : usage.databaseCounters) {
        if (!usage.layoutCounters.contains(counter))
          diagnostics.add(Diagnostic.of(DiagnosticKind.DATABASE_EXTRA_COUNTER, name + "." + counter, "Extra semantic counter in CounterInfo"));
      }
    });
    return report("semantic layout", diagnostics);
  }

  /**
   * Checks that every section and group documentation entry belongs to a section or group of the layout.
   * @return the check result
   */
  public CheckResult checkSemanticInfo() {
    List<Diagnostic> diagnostics = new ArrayList<>();
    SemanticLayout layout = database().semanticLayout();
    Set<String> layoutSections = layout.sections().stream().map(SemanticLayout.Section::name).collect(Collectors.toSet());
    Set<String> layoutGroups = layout.groups().map(SemanticLayout.Group::name).collect(Collectors.toSet());

    for (String name : database().sectionInfos().entries().keySet()) {
      if (!layoutSections.contains(name))
        diagnostics.add(Diagnostic.of(DiagnosticKind.EXTRA_SEMANTIC_INFO, name, "Extra section in SemanticSectionInfos"));
    }
    for (String name : database().groupInfos().entries().keySet()) {
      if (!layoutGroups.contains(name))
        diagnostics.add(Diagnostic.of(DiagnosticKind.EXTRA_SEMANTIC_INFO, name, "Extra group in SemanticGroupInfos"));
    }
    return report("semantic info", diagnostics);
  }

  ////////////////////////////// product checks //////////////////////////////

  private static void checkUnique(List<Diagnostic> out, Set<String> seen, Optional<String> name, String databaseKey, String reason) {
    if (name.isPresent() && !seen.add(name.get()))
      out.add(Diagnostic.forProduct(DiagnosticKind.DUPLICATE_NAME, databaseKey, name.get(), reason));
  }

  /**
   * Checks that source, machine, human and group names are unique among the counter entries of a product.
   * Works on the raw entries, since the compiled view keeps only one entry per name.
   * @param databaseKey the product database key
   * @return the check result
   */
  public CheckResult checkNameUniqueness(String databaseKey) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    Set<String> sourceNames = new HashSet<>();
    Set<String> machineNames = new HashSet<>();
    Set<String> humanNames = new HashSet<>();
    Set<String> groupNames = new HashSet<>();
    for (CounterInfo counter : database().counters()) {
      if (!counter.supportsGpu(databaseKey))
        continue;
      checkUnique(diagnostics, sourceNames, counter.getSourceName(), databaseKey, "Duplicate SourceName");
      checkUnique(diagnostics, machineNames, Optional.of(counter.getMachineName()), databaseKey, "Duplicate MachineName");
      checkUnique(diagnostics, humanNames, Optional.of(counter.getHumanName()), databaseKey, "Duplicate HumanName");
      checkUnique(diagnostics, groupNames, Optional.of(counter.getGroupName() + "." + counter.getGroupHumanName()), databaseKey,
                  "Duplicate GroupName/GroupHumanName");
    }
    return report("name uniqueness " + databaseKey, diagnostics);
  }

  /**
   * Checks that every hardware slot of a product has a counter entry and every native counter has a hardware slot.
   * @param databaseKey the product database key
   * @return the check result
   */
  public CheckResult checkSourceNameConsistency(String databaseKey) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    HardwareLayout layout = database().hardwareLayouts().getGpu(databaseKey);
    IndexedView view = spec.getIndexedViewFor(databaseKey);

    Set<String> hardwareNames = layout.counters().map(lookup -> lookup.counter().name()).collect(Collectors.toCollection(TreeSet::new));
    Set<String> viewNames = view.counters().stream().map(CounterView::getSourceName).flatMap(Optional::stream)
                                .collect(Collectors.toCollection(TreeSet::new));
    for (String name : hardwareNames) {
      if (!viewNames.contains(name))
        diagnostics.add(Diagnostic.forProduct(DiagnosticKind.SOURCE_NAME_MISMATCH, databaseKey, name, "SourceName only in HardwareView"));
    }
    for (String name : viewNames) {
      if (!hardwareNames.contains(name))
        diagnostics.add(Diagnostic.forProduct(DiagnosticKind.SOURCE_NAME_MISMATCH, databaseKey, name, "SourceName only in IndexedView"));
    }
    return report("source names " + databaseKey, diagnostics);
  }

  /**
   * Checks that every parsed equation of a product resolves. Parse failures are reported by {@link #checkEquationParse()}.
   * @param databaseKey the product database key
   * @return the check result
   */
  public CheckResult checkEquationResolve(String databaseKey) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (CounterView counter : spec.getIndexedViewFor(databaseKey).counters()) {
      if (counter.getEquationAst().isEmpty() || counter.getEquationAstResolved().isPresent())
        continue;
      diagnostics.add(Diagnostic.forProduct(DiagnosticKind.EQUATION_RESOLVE, databaseKey, counter.getMachineName(),
                                            "Bad equation resolve for CounterInfo", counter.getEquationResolveError().orElse("")));
    }
    return report("equation resolve " + databaseKey, diagnostics);
  }

  /**
   * Checks that equations combining counters of several cardinality domains scale each non-GPU domain by its instance count.
   * Only the presence of the scaling constant is checked, not its placement in the equation.
   * @param databaseKey the product database key
   * @return the check result
   */
  public CheckResult checkEquationCardinality(String databaseKey) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    IndexedView view = spec.getIndexedViewFor(databaseKey);
    for (CounterView counter : view.counters()) {
      if (counter.getEquationAstResolved().isEmpty() || cardinalityRules.exceptions().contains(counter.getMachineName()))
        continue;
      checkCardinality(diagnostics, databaseKey, view, counter, counter.getEquationAstResolved().get());
    }
    return report("equation cardinality " + databaseKey, diagnostics);
  }

  private void checkCardinality(List<Diagnostic> out, String databaseKey, IndexedView view, CounterView counter, EquationNode equation) {
    EnumSet<CardinalityDomain> domainUse = EnumSet.noneOf(CardinalityDomain.class);
    EnumSet<CardinalityDomain> scaleUse = EnumSet.noneOf(CardinalityDomain.class);
    for (String name : equation.names()) {
      // Names containing '(' are pre-rendered sub-expressions
      if (cardinalityRules.ignoredConstants().contains(name) || name.contains("("))
        continue;
      CardinalityDomain scaling = cardinalityRules.scalingConstants().get(name);
      if (scaling != null) {
        scaleUse.add(scaling);
        continue;
      }
      Optional<HardwareBlockType> blockType = view.getByMachineName(name).flatMap(CounterView::getBlockType);
      CardinalityDomain domain = blockType.map(cardinalityRules.domains()::get).orElse(null);
      if (domain == null) {
        out.add(Diagnostic.forProduct(DiagnosticKind.UNKNOWN_SYMBOL, databaseKey, counter.getMachineName(), "Unknown symbol in equation", name));
        continue;
      }
      domainUse.add(domain);
    }
    if (domainUse.size() <= 1)
      return;
    for (CardinalityDomain domain : domainUse) {
      if (domain != CardinalityDomain.GPU && !scaleUse.contains(domain)) {
        out.add(Diagnostic.forProduct(DiagnosticKind.CARDINALITY, databaseKey, counter.getMachineName(),
                                      "Missing cardinality scaling for " + domain));
      }
    }
  }

  private static void checkReferences(List<Diagnostic> out, IndexedView view, String databaseKey, String subject, String text, String source) {
    for (DocReference reference : DocReferences.parse(text)) {
      if (reference.isConstant()) {
        if (!reference.name().equals(DocReference.CONSTANT_GPU_NAME))
          out.add(Diagnostic.forProduct(DiagnosticKind.DOC_REFERENCE, databaseKey, subject, "Bad reference constant for " + source, reference.body()));
        if (!reference.part().isEmpty())
          out.add(Diagnostic.forProduct(DiagnosticKind.DOC_REFERENCE, databaseKey, subject, "Bad reference constant part for " + source,
                                        reference.body()));
      } else if (reference.isCounter()) {
        if (!reference.part().isEmpty() && !reference.part().equals(DocReference.PART_EQUATION))
          out.add(Diagnostic.forProduct(DiagnosticKind.DOC_REFERENCE, databaseKey, subject, "Bad doc reference postfix for " + source,
                                        reference.body()));
        if (view.getByMachineName(reference.name()).isEmpty())
          out.add(Diagnostic.forProduct(DiagnosticKind.DOC_REFERENCE, databaseKey, subject, "Bad doc reference target for " + source,
                                        reference.body()));
      } else {
        out.add(Diagnostic.forProduct(DiagnosticKind.DOC_REFERENCE, databaseKey, subject, "Bad reference type for " + source, reference.body()));
      }
    }
  }

  /**
   * Checks that the documentation references in the long descriptions of a product's counters resolve.
   * @param databaseKey the product database key
   * @return the check result
   */
  public CheckResult checkCounterDocumentation(String databaseKey) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    IndexedView view = spec.getIndexedViewFor(databaseKey);
    for (CounterView counter : view.counters())
      checkReferences(diagnostics, view, databaseKey, counter.getMachineName(), counter.getLongDescription(), "CounterInfo");
    return report("counter documentation " + databaseKey, diagnostics);
  }

  /**
   * Checks that the documentation references of the sections and groups shown for a product resolve.
   * @param databaseKey the product database key
   * @return the check result
   */
  public CheckResult checkSemanticDocumentation(String databaseKey) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    IndexedView view = spec.getIndexedViewFor(databaseKey);
    SemanticView semantic = spec.getSemanticViewFor(databaseKey);
    for (SemanticView.SectionView section : semantic.sections())
      checkReferences(diagnostics, view, databaseKey, section.name(), section.longDescription(), "SemanticSectionInfo");
    semantic.groups().forEach(
        group -> checkReferences(diagnostics, view, databaseKey, group.name(), group.longDescription(), "SemanticGroupInfo"));
    return report("semantic documentation " + databaseKey, diagnostics);
  }

  /**
   * Groups diagnostics by kind, for summaries.
   * @param results check results
   * @return number of diagnostics per kind
   */
  public static Map<DiagnosticKind, Long> countByKind(List<CheckResult> results) {
    return results.stream()
        .flatMap(result -> result.diagnostics().stream())
        .collect(Collectors.groupingBy(Diagnostic::kind, () -> new EnumMap<>(DiagnosticKind.class), Collectors.counting()));
  }
}
