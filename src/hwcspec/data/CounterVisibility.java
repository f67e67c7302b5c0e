package hwcspec.data;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Audience of a counter, ordered from most to least visible.
 */
public enum CounterVisibility {
  NOVICE("Novice"),
  ADVANCED_APPLICATION("Advanced application"),
  ADVANCED_SYSTEM("Advanced system"),
  INTERNAL("Internal");

  public final String serialName;

  private CounterVisibility(String serialName) { this.serialName = serialName; }

  /**
   * Tests if a counter with this visibility is shown when showing up to the given level.
   * @param max the highest visibility level shown
   * @return true iff this level does not exceed max
   */
  public boolean isAtMost(CounterVisibility max) { return this.ordinal() <= max.ordinal(); }

  public static Optional<CounterVisibility> fromSerialName(String name) {
    return Stream.of(values()).filter(val -> val.serialName.equals(name)).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
