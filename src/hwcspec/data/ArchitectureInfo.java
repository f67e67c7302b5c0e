package hwcspec.data;

import java.util.List;

/**
 * Documentation of one architecture, possibly specialized for some products.
 * @param architecture the architecture
 * @param longDescription the documentation text
 * @param gpuSupport database keys the entry applies to; empty for the default entry
 */
public record ArchitectureInfo(ProductArchitecture architecture, String longDescription, List<String> gpuSupport) {
  public ArchitectureInfo {
    gpuSupport = GpuNames.sort(gpuSupport);
  }
}
