package hwcspec.data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Configuration of one GPU product.
 * <p>
 * Products and hardware designs are not 1:1. Several products (e.g. with different core counts) can share one
 * design and thereby one {@link #getDatabaseKey() database key}.
 */
public class ProductInfo {
  public static final String FEATURE_ASYNC_CLOCK = "async_clock";

  private final List<Integer> ids;
  private final List<String> names;
  private final int releaseYear;
  private final ProductArchitecture architecture;
  private final ProductVisibility visibility;

  private Optional<String> documentName;
  private Optional<String> documentNameIndirect = Optional.empty();
  private String databaseKey;
  private List<String> features = new ArrayList<>();
  private Optional<String> engineeringName = Optional.empty();
  private Optional<String> projectName = Optional.empty();
  private Optional<String> architectureBranch = Optional.empty();

  public ProductInfo(List<Integer> ids, List<String> names, int releaseYear, ProductArchitecture architecture, ProductVisibility visibility) {
    if (ids.isEmpty() || names.isEmpty())
      throw new IllegalArgumentException("A product needs at least one id and one name");
    this.ids = List.copyOf(ids);
    this.names = List.copyOf(names);
    this.releaseYear = releaseYear;
    this.architecture = architecture;
    this.visibility = visibility;
    this.documentName = Optional.of(names.get(0));
    this.databaseKey = names.get(0);
  }

  public List<Integer> getIds() { return ids; }
  public List<String> getNames() { return names; }
  public String getName() { return names.get(0); }
  public int getReleaseYear() { return releaseYear; }
  public ProductArchitecture getArchitecture() { return architecture; }
  public ProductVisibility getVisibility() { return visibility; }
  public boolean isPublic() { return visibility == ProductVisibility.PUBLIC; }

  public String getDatabaseKey() { return databaseKey; }
  public void setDatabaseKey(String databaseKey) { this.databaseKey = databaseKey; }

  public List<String> getFeatures() { return features; }
  public void setFeatures(List<String> features) { this.features = new ArrayList<>(features); }
  public boolean hasFeature(String feature) { return features.contains(feature); }

  /** Set to empty if this product reuses the documentation of another product with the same database key. */
  public void setDocumentName(Optional<String> documentName) { this.documentName = documentName; }
  public void setDocumentNameIndirect(Optional<String> documentNameIndirect) { this.documentNameIndirect = documentNameIndirect; }

  /**
   * Gets the product name to use in documentation.
   * @param allowIndirect if true, falls back to the name of the product whose document this one reuses
   * @return the document name, empty if this product has no document of its own and indirect names are not allowed
   */
  public Optional<String> getDocumentName(boolean allowIndirect) {
    if (documentName.isPresent())
      return documentName;
    return allowIndirect ? documentNameIndirect : Optional.empty();
  }

  public Optional<String> getEngineeringName() { return engineeringName; }
  public void setEngineeringName(Optional<String> engineeringName) { this.engineeringName = engineeringName; }
  public Optional<String> getProjectName() { return projectName; }
  public void setProjectName(Optional<String> projectName) { this.projectName = projectName; }
  public Optional<String> getArchitectureBranch() { return architectureBranch; }
  public void setArchitectureBranch(Optional<String> architectureBranch) { this.architectureBranch = architectureBranch; }

  @Override
  public String toString() {
    return getName() + " (" + databaseKey + ")";
  }
}
