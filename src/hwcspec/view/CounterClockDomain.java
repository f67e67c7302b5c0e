package hwcspec.view;

/** Clock domain a native counter counts in. */
public enum CounterClockDomain {
  GPU,
  SHADER_CORE
}
