package hwcspec.data;

import java.util.Optional;
import java.util.stream.Stream;

/** Kind of a hardware counter block. */
public enum HardwareBlockType {
  GPU_FRONTEND("GPU Front-end"),
  SHADER_CORE("Shader Core"),
  MEMORY_SYSTEM("Memory System"),
  TILER("Tiler");

  public final String serialName;

  private HardwareBlockType(String serialName) { this.serialName = serialName; }

  public static Optional<HardwareBlockType> fromSerialName(String name) {
    return Stream.of(values()).filter(val -> val.serialName.equals(name)).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
