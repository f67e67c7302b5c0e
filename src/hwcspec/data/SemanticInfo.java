package hwcspec.data;

import java.util.List;

/**
 * Documentation of one section or group.
 * @param name section name or group name
 * @param longDescription the documentation text
 * @param gpuSupport database keys the entry applies to; empty for the default entry
 */
public record SemanticInfo(String name, String longDescription, List<String> gpuSupport) {
  public SemanticInfo {
    gpuSupport = GpuNames.sort(gpuSupport);
  }

  public boolean isDefault() { return gpuSupport.isEmpty(); }
}
