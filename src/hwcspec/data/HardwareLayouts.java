package hwcspec.data;

import hwcspec.SpecConsistencyException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Optional;

/** Hardware layouts of all database keys. */
public class HardwareLayouts {
  private final LinkedHashMap<String, HardwareLayout> layouts = new LinkedHashMap<>();

  public void add(HardwareLayout layout) {
    if (layouts.put(layout.databaseKey(), layout) != null)
      throw new SpecConsistencyException("Hardware layout for " + layout.databaseKey() + " defined twice");
  }

  public Optional<HardwareLayout> find(String databaseKey) { return Optional.ofNullable(layouts.get(databaseKey)); }

  public HardwareLayout getGpu(String databaseKey) {
    return find(databaseKey).orElseThrow(() -> new SpecConsistencyException("No hardware layout for " + databaseKey));
  }

  public Collection<HardwareLayout> layouts() { return layouts.values(); }
}
