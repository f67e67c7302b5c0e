package hwcspec.data;

import hwcspec.equation.ParsedEquation;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One counter entry of the raw, multi-product counter database.
 * <p>
 * The same machine name may appear in several entries, each applying to a different set of products.
 * Entries are immutable apart from the stable ID, which may be assigned after loading while the database is being edited.
 */
public class CounterInfo {
  private final String sourceFile;
  private final String machineName;
  private OptionalInt stableId;
  private final String humanName;
  private final String groupName;
  private final String groupHumanName;
  private final String shortDescription;
  private final String longDescription;
  private final String units;
  private final CounterTrend trend;
  private final CounterVisibility visibility;
  private final CounterDefinition definition;
  private final List<String> gpuSupport;

  public CounterInfo(String sourceFile, String machineName, OptionalInt stableId, String humanName, String groupName, String groupHumanName,
                     String shortDescription, String longDescription, String units, CounterTrend trend, CounterVisibility visibility,
                     CounterDefinition definition, List<String> gpuSupport) {
    this.sourceFile = Objects.requireNonNull(sourceFile);
    this.machineName = Objects.requireNonNull(machineName);
    this.stableId = Objects.requireNonNull(stableId);
    this.humanName = Objects.requireNonNull(humanName);
    this.groupName = Objects.requireNonNull(groupName);
    this.groupHumanName = Objects.requireNonNull(groupHumanName);
    this.shortDescription = Objects.requireNonNull(shortDescription);
    this.longDescription = Objects.requireNonNull(longDescription);
    this.units = Objects.requireNonNull(units);
    this.trend = Objects.requireNonNull(trend);
    this.visibility = Objects.requireNonNull(visibility);
    this.definition = Objects.requireNonNull(definition);
    this.gpuSupport = GpuNames.sort(gpuSupport);
  }

  /** @return the database file this entry was loaded from, relative to the counter directory */
  public String getSourceFile() { return sourceFile; }
  public String getMachineName() { return machineName; }
  public OptionalInt getStableId() { return stableId; }
  public void setStableId(int stableId) { this.stableId = OptionalInt.of(stableId); }
  public String getHumanName() { return humanName; }
  public String getGroupName() { return groupName; }
  public String getGroupHumanName() { return groupHumanName; }
  public String getShortDescription() { return shortDescription; }
  public String getLongDescription() { return longDescription; }
  public String getUnits() { return units; }
  public CounterTrend getTrend() { return trend; }
  public CounterVisibility getVisibility() { return visibility; }
  public CounterDefinition getDefinition() { return definition; }
  /** @return the database keys of the products this entry applies to, in presentation order */
  public List<String> getGpuSupport() { return gpuSupport; }

  public boolean supportsGpu(String databaseKey) { return gpuSupport.contains(databaseKey); }

  public boolean isDerived() { return definition instanceof CounterDefinition.Equation; }

  /** @return the primary hardware name, empty for derived counters */
  public Optional<String> getSourceName() {
    if (definition instanceof CounterDefinition.Hardware hardware)
      return Optional.of(hardware.sourceName());
    return Optional.empty();
  }

  /** @return the parsed equation, empty for native counters */
  public Optional<ParsedEquation> getEquation() {
    if (definition instanceof CounterDefinition.Equation equation)
      return Optional.of(equation.equation());
    return Optional.empty();
  }

  @Override
  public String toString() {
    return machineName + (stableId.isPresent() ? "#" + stableId.getAsInt() : "") + " " + gpuSupport;
  }
}
