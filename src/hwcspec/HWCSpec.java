package hwcspec;

import hwcspec.data.ArchitectureInfo;
import hwcspec.data.MissingDocumentationException;
import hwcspec.data.ProductInfo;
import hwcspec.data.SpecDatab;
import hwcspec.data.SpecDatabase;
import hwcspec.data.SpecFormatException;
import hwcspec.view.HardwareView;
import hwcspec.view.IndexedView;
import hwcspec.view.SemanticView;
import java.io.File;
import java.util.HashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point to a loaded counter specification.
 * Compiles per-product views on demand and caches them by product name.
 */
public class HWCSpec {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final SpecDatabase database;

  private final HashMap<String, IndexedView> indexedViews = new HashMap<>();
  private final HashMap<String, HardwareView> hardwareViews = new HashMap<>();
  private final HashMap<String, SemanticView> semanticViews = new HashMap<>();

  public HWCSpec(SpecDatabase database) { this.database = database; }

  /**
   * Loads the specification from a database directory.
   * @param root the database directory
   * @return the loaded specification
   * @throws SpecFormatException if the database cannot be read
   */
  public static HWCSpec load(File root) throws SpecFormatException { return new HWCSpec(new SpecDatab(root).load()); }

  public SpecDatabase getDatabase() { return database; }

  /**
   * Drops all compiled views. Needed after counter entries were edited in place.
   */
  public void clearCache() {
    indexedViews.clear();
    hardwareViews.clear();
    semanticViews.clear();
  }

  /** @return all product names, including aliases */
  public List<String> getSupportedGpus() { return database.products().getGpus(); }

  /** @return all distinct database keys */
  public List<String> getSupportedDatabaseKeys() { return database.products().getDatabaseKeys(); }

  /**
   * @param product the product name or database key
   * @return the product
   * @throws SpecConsistencyException if the product is unknown
   */
  public ProductInfo getProductInfoFor(String product) { return database.products().getGpu(product); }

  /**
   * Gets the architecture documentation for a product.
   * @param product the product name or database key
   * @return the most specific architecture entry
   * @throws MissingDocumentationException if the architecture of the product is not documented
   */
  public ArchitectureInfo getArchitectureInfoFor(String product) throws MissingDocumentationException {
    ProductInfo info = getProductInfoFor(product);
    return database.architectures().getInfoFor(info.getDatabaseKey(), info.getArchitecture());
  }

  /**
   * Gets the complete view of a product, with all equations resolved.
   * @param product the product name or database key
   * @return the cached view
   * @throws SpecConsistencyException if the product or its hardware layout is unknown, or a counter lacks a stable ID
   */
  public IndexedView getIndexedViewFor(String product) {
    IndexedView view = indexedViews.get(product);
    if (view == null) {
      ProductInfo info = getProductInfoFor(product);
      view = IndexedView.build(product, info, database.hardwareLayouts().getGpu(info.getDatabaseKey()), database.counters());
      view.resolveEquations();
      logger.debug("Compiled {}", view);
      indexedViews.put(product, view);
    }
    return view;
  }

  /**
   * @param product the product name or database key
   * @return the cached hardware view
   * @throws SpecConsistencyException if a hardware slot has no counter entry
   */
  public HardwareView getHardwareViewFor(String product) {
    HardwareView view = hardwareViews.get(product);
    if (view == null) {
      IndexedView indexed = getIndexedViewFor(product);
      view = HardwareView.build(database.hardwareLayouts().getGpu(indexed.getDatabaseKey()), indexed);
      hardwareViews.put(product, view);
    }
    return view;
  }

  /**
   * @param product the product name or database key
   * @return the cached semantic view
   */
  public SemanticView getSemanticViewFor(String product) {
    SemanticView view = semanticViews.get(product);
    if (view == null) {
      IndexedView indexed = getIndexedViewFor(product);
      view = SemanticView.build(indexed.getDatabaseKey(), database.semanticLayout(), database.sectionInfos(), database.groupInfos(), indexed);
      semanticViews.put(product, view);
    }
    return view;
  }
}
