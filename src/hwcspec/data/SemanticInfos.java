package hwcspec.data;

import hwcspec.SpecConsistencyException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Per-product documentation of sections or of groups, selected by most-specific match.
 */
public class SemanticInfos {
  private final LinkedHashMap<String, List<SemanticInfo>> infos = new LinkedHashMap<>();

  public void add(SemanticInfo info) { infos.computeIfAbsent(info.name(), name -> new ArrayList<>()).add(info); }

  public Map<String, List<SemanticInfo>> entries() { return infos; }

  /**
   * Gets the documentation entry for a product.
   * An entry naming the database key is preferred over the default entry.
   * @param databaseKey the product database key
   * @param name the section or group name
   * @return the matching entry
   * @throws MissingDocumentationException if there is neither a matching nor a default entry
   * @throws SpecConsistencyException if there are several default entries
   */
  public SemanticInfo getInfoFor(String databaseKey, String name) throws MissingDocumentationException {
    List<SemanticInfo> candidates = infos.get(name);
    if (candidates == null)
      throw new MissingDocumentationException("No documentation for " + name);
    return selectMostSpecific(candidates, databaseKey, name, SemanticInfo::gpuSupport);
  }

  static <T> T selectMostSpecific(List<T> candidates, String databaseKey, String name, Function<T, List<String>> supportOf)
      throws MissingDocumentationException {
    T fallback = null;
    for (T candidate : candidates) {
      List<String> support = supportOf.apply(candidate);
      if (support.contains(databaseKey))
        return candidate;
      if (support.isEmpty()) {
        if (fallback != null)
          throw new SpecConsistencyException("Two default documentation entries for " + name);
        fallback = candidate;
      }
    }
    if (fallback == null)
      throw new MissingDocumentationException("No documentation for " + name + " on " + databaseKey);
    return fallback;
  }
}
