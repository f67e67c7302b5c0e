package hwcspec.drc;

/** Hardware domains whose instance count varies independently across product configurations. */
public enum CardinalityDomain {
  GPU,
  MEM,
  SC
}
