package hwcspec.data;

/**
 * All raw databases, loaded once and read-only afterwards. Only stable ID assignment edits counter entries in place.
 */
public record SpecDatabase(ProductInfos products, ArchitectureInfos architectures, CounterInfos counters, HardwareLayouts hardwareLayouts,
                           SemanticLayout semanticLayout, SemanticInfos sectionInfos, SemanticInfos groupInfos) {}
