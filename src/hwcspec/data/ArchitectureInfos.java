package hwcspec.data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

/** Architecture documentation, selected by most-specific match like {@link SemanticInfos}. */
public class ArchitectureInfos {
  private final EnumMap<ProductArchitecture, List<ArchitectureInfo>> infos = new EnumMap<>(ProductArchitecture.class);

  public void add(ArchitectureInfo info) { infos.computeIfAbsent(info.architecture(), arch -> new ArrayList<>()).add(info); }

  public List<ArchitectureInfo> entries() { return infos.values().stream().flatMap(List::stream).toList(); }

  /**
   * Gets the architecture documentation for a product.
   * @param databaseKey the product database key
   * @param architecture the product architecture
   * @return the matching entry
   * @throws MissingDocumentationException if there is neither a matching nor a default entry
   */
  public ArchitectureInfo getInfoFor(String databaseKey, ProductArchitecture architecture) throws MissingDocumentationException {
    List<ArchitectureInfo> candidates = infos.get(architecture);
    if (candidates == null)
      throw new MissingDocumentationException("No architecture documentation for " + architecture);
    return SemanticInfos.selectMostSpecific(candidates, databaseKey, architecture.serialName, ArchitectureInfo::gpuSupport);
  }
}
