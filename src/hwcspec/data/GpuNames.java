package hwcspec.data;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Presentation order of GPU product names.
 * The order roughly follows product age but is not a date sort, e.g. Mali-G68 sorts before Mali-G77.
 */
public final class GpuNames {
  // Bifrost, Valhall and early 5th Generation names, e.g. Mali-G77
  private static final Pattern GROUP_0 = Pattern.compile("^(Mali|Immortalis)-G(\\d+)$");
  // Later 5th Generation names without postfix, e.g. Mali G1
  private static final Pattern GROUP_1 = Pattern.compile("^Mali G(\\d+)$");
  // Later 5th Generation names with postfix, e.g. Mali G1-Ultra
  private static final Pattern GROUP_2 = Pattern.compile("^Mali G(\\d+)-(\\S+)$");
  // Codenames with non-numeric identifiers
  private static final Pattern GROUP_3 = Pattern.compile("^Mali (\\S+)$");

  private static final Map<String, Integer> GROUP_0_BRANDS = Map.of("Mali", 0, "Immortalis", 1);
  private static final Map<String, Integer> GROUP_2_TIERS = Map.of("Pro", 0, "Premium", 1, "Ultra", 2);

  record SortKey(int group, long product, int subproduct, String name) {}

  private static final Comparator<SortKey> ORDER = Comparator.comparingInt(SortKey::group)
                                                       .thenComparingLong(SortKey::product)
                                                       .thenComparingInt(SortKey::subproduct)
                                                       .thenComparing(SortKey::name);

  private GpuNames() {}

  static SortKey sortKey(String name) {
    Matcher m;
    if ((m = GROUP_0.matcher(name)).matches())
      return new SortKey(0, Long.parseLong(m.group(2)), GROUP_0_BRANDS.get(m.group(1)), name);
    if ((m = GROUP_1.matcher(name)).matches())
      return new SortKey(1, Long.parseLong(m.group(1)), 0, name);
    if ((m = GROUP_2.matcher(name)).matches())
      return new SortKey(2, Long.parseLong(m.group(1)), GROUP_2_TIERS.getOrDefault(m.group(2), GROUP_2_TIERS.size()), name);
    if ((m = GROUP_3.matcher(name)).matches()) {
      String code = m.group(1);
      long product = 0;
      for (int i = 0; i < code.length(); ++i)
        product += (long)(code.length() - i) * 256 * code.charAt(i);
      return new SortKey(3, product, 0, name);
    }
    // Names outside the known schemes go last
    return new SortKey(4, 0, 0, name);
  }

  /**
   * Sorts product names into presentation order, oldest first.
   * @param names the unsorted names
   * @return a new sorted list
   */
  public static List<String> sort(Collection<String> names) {
    return names.stream().map(GpuNames::sortKey).sorted(ORDER).map(SortKey::name).toList();
  }
}
