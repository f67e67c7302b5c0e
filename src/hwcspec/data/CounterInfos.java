package hwcspec.data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The raw counter database, in load order.
 */
public class CounterInfos extends ArrayList<CounterInfo> {
  private static final long serialVersionUID = 1L;

  public CounterInfos() {}

  public CounterInfos(Collection<CounterInfo> counters) { super(counters); }

  /**
   * Groups entries by the file they were loaded from, keeping the load order.
   * @return map from source file to its entries
   */
  public Map<String, List<CounterInfo>> bySourceFile() {
    Map<String, List<CounterInfo>> ret = new LinkedHashMap<>();
    for (CounterInfo counter : this)
      ret.computeIfAbsent(counter.getSourceFile(), file -> new ArrayList<>()).add(counter);
    return ret;
  }
}
