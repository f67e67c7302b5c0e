package hwcspec.data;

import hwcspec.SpecConsistencyException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * All known products, indexed by every product name.
 */
public class ProductInfos {
  private final LinkedHashMap<String, ProductInfo> products = new LinkedHashMap<>();

  /**
   * Adds a product under all its names.
   * @param product the product
   */
  public void add(ProductInfo product) {
    for (String name : product.getNames()) {
      if (products.put(name, product) != null)
        throw new SpecConsistencyException("Product name " + name + " defined twice");
    }
  }

  /**
   * Fills in the indirect document names of products that reuse another product's documentation.
   * Called once after all products are added.
   */
  public void linkDocumentNames() {
    for (ProductInfo product : products.values()) {
      if (product.getDocumentName(false).isPresent())
        continue;
      product.setDocumentNameIndirect(getGpuDocumentationPrimary(product.getName()).getDocumentName(false));
    }
  }

  /** @return all product names, including public aliases of the same hardware */
  public List<String> getGpus() { return new ArrayList<>(products.keySet()); }

  /** @return the distinct products, in load order */
  public Collection<ProductInfo> products() { return products.values().stream().distinct().toList(); }

  /** @return the distinct database keys, in load order */
  public List<String> getDatabaseKeys() { return products().stream().map(ProductInfo::getDatabaseKey).distinct().toList(); }

  public Optional<ProductInfo> findGpu(String name) {
    ProductInfo direct = products.get(name);
    if (direct != null)
      return Optional.of(direct);
    return products.values().stream().filter(product -> product.getDatabaseKey().equals(name)).findFirst();
  }

  /**
   * Looks up a product by product name or database key.
   * @param name the product name or database key
   * @return the product
   * @throws SpecConsistencyException if the product is unknown
   */
  public ProductInfo getGpu(String name) {
    return findGpu(name).orElseThrow(() -> new SpecConsistencyException("Unknown GPU product " + name));
  }

  /**
   * Gets the product that owns the documentation for a product. Products sharing a database key may share one document.
   * @param name the product name or database key
   * @return the documentation primary
   */
  public ProductInfo getGpuDocumentationPrimary(String name) {
    ProductInfo product = getGpu(name);
    if (product.getDocumentName(false).isPresent())
      return product;
    return products.values()
        .stream()
        .filter(other -> other.getDatabaseKey().equals(product.getDatabaseKey()) && other.getDocumentName(false).isPresent())
        .findFirst()
        .orElseThrow(() -> new SpecConsistencyException("Unknown GPU product documentation primary " + name));
  }

  /**
   * Gets the names of all products sharing the database key of a product.
   * @param name the product name or database key
   * @return all matching product names
   */
  public List<String> getAliasesFor(String name) {
    String key = getGpu(name).getDatabaseKey();
    return products().stream().filter(product -> product.getDatabaseKey().equals(key)).flatMap(product -> product.getNames().stream()).toList();
  }
}
