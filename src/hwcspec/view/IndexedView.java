package hwcspec.view;

import hwcspec.data.CounterInfo;
import hwcspec.data.CounterVisibility;
import hwcspec.data.HardwareLayout;
import hwcspec.data.ProductInfo;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * All counters of one product, with lookups by stable ID and case-insensitive lookups by name.
 * <p>
 * The stable ID map is the single store. The name indices are derived from it by {@link #rebuildIndices()}
 * and are never edited on their own.
 */
public class IndexedView {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Name keys a counter can be looked up by. */
  public enum CounterIndex {
    MACHINE_NAME(counter -> Optional.of(IgnoreCaseKey.of(counter.getMachineName()))),
    SOURCE_NAME(counter -> counter.getSourceName().map(IgnoreCaseKey::of)),
    HUMAN_NAME(counter -> Optional.of(IgnoreCaseKey.of(counter.getHumanName()))),
    GROUP_NAMES(counter -> Optional.of(IgnoreCaseKey.ofGroup(counter.getGroupName(), counter.getGroupHumanName())));

    private final Function<CounterView, Optional<IgnoreCaseKey>> keyOf;

    private CounterIndex(Function<CounterView, Optional<IgnoreCaseKey>> keyOf) { this.keyOf = keyOf; }

    public Optional<IgnoreCaseKey> keyOf(CounterView counter) { return keyOf.apply(counter); }
  }

  private final String product;
  private final String databaseKey;
  private final LinkedHashMap<Integer, CounterView> byStableId = new LinkedHashMap<>();
  private final EnumMap<CounterIndex, Map<IgnoreCaseKey, CounterView>> indices = new EnumMap<>(CounterIndex.class);

  /**
   * Creates a view over a set of compiled counters. Later counters replace earlier ones with the same stable ID.
   * @param product the product name, which may be an alias
   * @param databaseKey the database key of the product
   * @param counters the compiled counters
   */
  public IndexedView(String product, String databaseKey, Collection<CounterView> counters) {
    this.product = product;
    this.databaseKey = databaseKey;
    for (CounterView counter : counters) {
      CounterView replaced = byStableId.put(counter.getStableId(), counter);
      if (replaced != null)
        logger.debug("{}: stable ID {} of {} replaced by {}", product, counter.getStableId(), replaced.getMachineName(), counter.getMachineName());
    }
    rebuildIndices();
  }

  private void rebuildIndices() {
    indices.clear();
    for (CounterIndex index : CounterIndex.values()) {
      Map<IgnoreCaseKey, CounterView> map = new HashMap<>();
      for (CounterView counter : byStableId.values()) {
        index.keyOf(counter).ifPresent(key -> {
          CounterView replaced = map.put(key, counter);
          if (replaced != null)
            logger.debug("{}: {} key '{}' of {} replaced by {}", product, index, key.normalized(), replaced, counter);
        });
      }
      indices.put(index, map);
    }
  }

  /**
   * Compiles the counters of one product. Equations are not resolved here, see {@link #resolveEquations()}.
   * @param product the product name, which may be an alias
   * @param productInfo the product
   * @param layout the hardware layout of the product
   * @param counters the complete counter database
   * @return the unresolved view
   */
  public static IndexedView build(String product, ProductInfo productInfo, HardwareLayout layout, Collection<CounterInfo> counters) {
    String databaseKey = productInfo.getDatabaseKey();
    var compiled = counters.stream()
                       .filter(counter -> counter.supportsGpu(databaseKey))
                       .map(counter -> new CounterView(productInfo, counter, CounterView.placementOf(counter, layout)))
                       .toList();
    logger.debug("Compiled {} of {} counter entries for {}", compiled.size(), counters.size(), product);
    return new IndexedView(product, databaseKey, compiled);
  }

  /**
   * Resolves the equations of all derived counters. Requires the complete view, since an equation may reference any counter.
   */
  public void resolveEquations() {
    for (CounterView counter : byStableId.values())
      counter.resolveEquation(this);
  }

  /**
   * Creates a filtered copy of this view. This view is not changed.
   * @param maxVisibility the highest visibility level kept
   * @param allowDerived whether derived counters are kept
   * @return the filtered view
   */
  public IndexedView filter(CounterVisibility maxVisibility, boolean allowDerived) {
    return new IndexedView(product, databaseKey,
                           byStableId.values().stream().filter(counter -> isShown(counter, maxVisibility, allowDerived)).toList());
  }

  static boolean isShown(CounterView counter, CounterVisibility maxVisibility, boolean allowDerived) {
    return counter.isVisible(maxVisibility) && (allowDerived || !counter.isDerived());
  }

  public String getProduct() { return product; }
  public String getDatabaseKey() { return databaseKey; }

  /** @return all counters, in stable ID insertion order */
  public Collection<CounterView> counters() { return Collections.unmodifiableCollection(byStableId.values()); }
  public int size() { return byStableId.size(); }

  public Optional<CounterView> getByStableId(int stableId) { return Optional.ofNullable(byStableId.get(stableId)); }

  public Optional<CounterView> get(CounterIndex index, String name) { return Optional.ofNullable(indices.get(index).get(IgnoreCaseKey.of(name))); }

  public Optional<CounterView> getByMachineName(String name) { return get(CounterIndex.MACHINE_NAME, name); }
  public Optional<CounterView> getBySourceName(String name) { return get(CounterIndex.SOURCE_NAME, name); }
  public Optional<CounterView> getByHumanName(String name) { return get(CounterIndex.HUMAN_NAME, name); }

  public Optional<CounterView> getByGroupNames(String groupName, String groupHumanName) {
    return Optional.ofNullable(indices.get(CounterIndex.GROUP_NAMES).get(IgnoreCaseKey.ofGroup(groupName, groupHumanName)));
  }

  @Override
  public String toString() {
    return "IndexedView " + product + " (" + databaseKey + "): " + size() + " counters";
  }
}
