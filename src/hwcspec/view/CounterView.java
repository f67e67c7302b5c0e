package hwcspec.view;

import hwcspec.SpecConsistencyException;
import hwcspec.data.CounterDefinition;
import hwcspec.data.CounterInfo;
import hwcspec.data.CounterTrend;
import hwcspec.data.CounterVisibility;
import hwcspec.data.HardwareBlockType;
import hwcspec.data.HardwareLayout;
import hwcspec.data.ProductInfo;
import hwcspec.equation.EquationNode;
import hwcspec.equation.EquationResolveException;
import hwcspec.equation.EquationResolver;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A counter compiled for one product: the counter entry merged with its hardware placement on that product.
 * Immutable apart from the single {@link #resolveEquation(IndexedView)} step.
 */
public class CounterView {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final CounterInfo info;
  private final int stableId;
  private final CounterSource source;
  private final Optional<CounterClockDomain> clockDomain;

  private Optional<EquationNode> equationAstResolved = Optional.empty();
  private Optional<String> equationResolveError = Optional.empty();

  /**
   * Compiles a counter entry for a product.
   * @param product the product
   * @param info the counter entry, which must carry a stable ID
   * @param source the placement of the counter on this product
   */
  public CounterView(ProductInfo product, CounterInfo info, CounterSource source) {
    this.info = info;
    this.stableId = info.getStableId().orElseThrow(
        () -> new SpecConsistencyException("Counter " + info.getMachineName() + " has no stable ID and cannot be compiled"));
    this.source = source;
    this.clockDomain = clockDomainOf(product, source);
  }

  /**
   * Builds the placement of a counter entry by searching its hardware names, in order, in the layout.
   * A native counter with no matching slot keeps its primary source name and has no block.
   * @param info the counter entry
   * @param layout the product hardware layout
   * @return the placement
   */
  public static CounterSource placementOf(CounterInfo info, HardwareLayout layout) {
    if (info.getDefinition() instanceof CounterDefinition.Equation equation)
      return new CounterSource.Derived(equation.equation());
    CounterDefinition.Hardware hardware = (CounterDefinition.Hardware)info.getDefinition();
    for (String name : hardware.sourceNames()) {
      var slot = layout.getCounterByName(name);
      if (slot.isPresent()) {
        return new CounterSource.Native(name, Optional.of(slot.get().block().type()), slot.get().counter().index(),
                                        slot.get().counter().scaleMultiplier());
      }
    }
    logger.debug("No hardware slot for {} on {}", info.getMachineName(), layout.databaseKey());
    return new CounterSource.Native(hardware.sourceName(), Optional.empty(), 0, 1);
  }

  static Optional<CounterClockDomain> clockDomainOf(ProductInfo product, CounterSource source) {
    if (!(source instanceof CounterSource.Native nativeSource) || nativeSource.blockType().isEmpty())
      return Optional.empty();
    if (!product.hasFeature(ProductInfo.FEATURE_ASYNC_CLOCK))
      return Optional.of(CounterClockDomain.GPU);
    if (nativeSource.blockType().get() == HardwareBlockType.SHADER_CORE)
      return Optional.of(CounterClockDomain.SHADER_CORE);
    return Optional.of(CounterClockDomain.GPU);
  }

  /**
   * Resolves the equation of a derived counter against the complete product view, storing the result or the error.
   * Does nothing for native counters and for equations that failed to parse, which are reported as parse errors.
   * @param view the view this counter belongs to
   */
  public void resolveEquation(IndexedView view) {
    if (getEquationAst().isEmpty())
      return;
    try {
      equationAstResolved = Optional.of(new EquationResolver(view).resolve(this));
      equationResolveError = Optional.empty();
    } catch (EquationResolveException e) {
      logger.debug("Cannot resolve {} on {}: {}", getMachineName(), view.getProduct(), e.getMessage());
      equationAstResolved = Optional.empty();
      equationResolveError = Optional.of(e.getMessage());
    }
  }

  public CounterInfo getInfo() { return info; }
  public int getStableId() { return stableId; }
  public String getMachineName() { return info.getMachineName(); }
  public String getHumanName() { return info.getHumanName(); }
  public String getGroupName() { return info.getGroupName(); }
  public String getGroupHumanName() { return info.getGroupHumanName(); }
  public String getShortDescription() { return info.getShortDescription(); }
  public String getLongDescription() { return info.getLongDescription(); }
  public String getUnits() { return info.getUnits(); }
  public CounterTrend getTrend() { return info.getTrend(); }
  public CounterVisibility getVisibility() { return info.getVisibility(); }
  public CounterSource getSource() { return source; }
  public Optional<CounterClockDomain> getClockDomain() { return clockDomain; }

  public boolean isDerived() { return source instanceof CounterSource.Derived; }

  /** @return the hardware name used on this product, empty for derived counters */
  public Optional<String> getSourceName() {
    if (source instanceof CounterSource.Native nativeSource)
      return Optional.of(nativeSource.sourceName());
    return Optional.empty();
  }

  public Optional<HardwareBlockType> getBlockType() {
    if (source instanceof CounterSource.Native nativeSource)
      return nativeSource.blockType();
    return Optional.empty();
  }

  public int getBlockIndex() { return (source instanceof CounterSource.Native nativeSource) ? nativeSource.blockIndex() : 0; }

  public int getScaleMultiplier() { return (source instanceof CounterSource.Native nativeSource) ? nativeSource.scaleMultiplier() : 1; }

  /** @return the equation as authored, empty for native counters and for equations that failed to parse */
  public Optional<EquationNode> getEquationAst() {
    if (source instanceof CounterSource.Derived derived)
      return derived.ast();
    return Optional.empty();
  }

  /** @return the equation expanded to native counters, constants and literals; empty before resolving or on error */
  public Optional<EquationNode> getEquationAstResolved() { return equationAstResolved; }
  public Optional<String> getEquationResolveError() { return equationResolveError; }

  public boolean isVisible(CounterVisibility maxVisibility) { return getVisibility().isAtMost(maxVisibility); }

  /** @return a stable documentation anchor, unchanged as long as the stable ID is */
  public String getAnchor() { return "c_" + stableId; }

  @Override
  public String toString() {
    return getMachineName() + "#" + stableId;
  }
}
