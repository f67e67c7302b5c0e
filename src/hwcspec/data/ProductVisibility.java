package hwcspec.data;

import java.util.Optional;
import java.util.stream.Stream;

public enum ProductVisibility {
  PUBLIC("Public"),
  CONFIDENTIAL("Confidential");

  public final String serialName;

  private ProductVisibility(String serialName) { this.serialName = serialName; }

  public static Optional<ProductVisibility> fromSerialName(String name) {
    return Stream.of(values()).filter(val -> val.serialName.equals(name)).findAny();
  }
}
