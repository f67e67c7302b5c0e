package hwcspec.data;

import java.util.Optional;
import java.util.stream.Stream;

public enum ProductArchitecture {
  BIFROST("Bifrost"),
  VALHALL("Valhall"),
  FIFTH_GENERATION("5th Generation");

  public final String serialName;

  private ProductArchitecture(String serialName) { this.serialName = serialName; }

  public static Optional<ProductArchitecture> fromSerialName(String name) {
    return Stream.of(values()).filter(val -> val.serialName.equals(name)).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
