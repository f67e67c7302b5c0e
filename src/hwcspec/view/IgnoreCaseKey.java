package hwcspec.view;

import java.util.Locale;

/**
 * Case-insensitive lookup key.
 */
public record IgnoreCaseKey(String normalized) {
  public static IgnoreCaseKey of(String name) { return new IgnoreCaseKey(name.toLowerCase(Locale.ROOT)); }

  public static IgnoreCaseKey ofGroup(String groupName, String groupHumanName) { return of(groupName + "|" + groupHumanName); }
}
