package hwcspec.data;

import java.util.Optional;
import java.util.stream.Stream;

/** Desirable direction of a counter value. */
public enum CounterTrend {
  HIGHER_BETTER("Higher better"),
  INFORMATIVE("Informative"),
  LOWER_BETTER("Lower better");

  public final String serialName;

  private CounterTrend(String serialName) { this.serialName = serialName; }

  public static Optional<CounterTrend> fromSerialName(String name) {
    return Stream.of(values()).filter(val -> val.serialName.equals(name)).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
