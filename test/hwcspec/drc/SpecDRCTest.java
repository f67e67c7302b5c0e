package hwcspec.drc;

import hwcspec.HWCSpec;
import hwcspec.TestDatabaseBuilder;
import hwcspec.data.CounterInfo;
import hwcspec.data.HardwareBlockType;
import java.io.File;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SpecDRCTest {

  private static TestDatabaseBuilder threeDomains() {
    return new TestDatabaseBuilder()
        .product("Mali-G710")
        .block("Mali-G710", HardwareBlockType.GPU_FRONTEND, "GPU_ACTIVE")
        .block("Mali-G710", HardwareBlockType.SHADER_CORE, "FRAG_ACTIVE")
        .block("Mali-G710", HardwareBlockType.MEMORY_SYSTEM, "L2_RD_BEATS")
        .nativeCounter("MaliGpuCy", 0, "GPU_ACTIVE")
        .nativeCounter("MaliFragCy", 1, "FRAG_ACTIVE")
        .nativeCounter("MaliMemBt", 2, "L2_RD_BEATS");
  }

  private static List<Diagnostic> diagnostics(CheckResult result, DiagnosticKind kind) {
    return result.diagnostics().stream().filter(diagnostic -> diagnostic.kind() == kind).toList();
  }

  @Test
  void testFixtureIsClean() throws Exception {
    HWCSpec spec = HWCSpec.load(new File("testdata/hwcspec/database"));
    List<CheckResult> results = new SpecDRC(spec).runAll();
    Assertions.assertEquals(0, CheckResult.totalErrors(results), () -> results.toString());
    Assertions.assertTrue(SpecDRC.countByKind(results).isEmpty());
  }

  @ParameterizedTest
  @CsvSource({"MaliFragCy / MaliGpuCy, 1", "MaliFragCy / MaliGpuCy * MALI_CONFIG_SHADER_CORE_COUNT, 0",
              "MALI_CONFIG_SHADER_CORE_COUNT * MaliFragCy / MaliGpuCy, 0", "MaliFragCy / MaliMemBt, 2",
              "MaliFragCy / MaliMemBt / MALI_CONFIG_SHADER_CORE_COUNT * MALI_CONFIG_L2_CACHE_COUNT, 0", "MaliGpuCy * MALI_CONFIG_TIME_SPAN, 0",
              "MaliFragCy + MaliFragCy, 0", "MaliMemBt * MALI_CONFIG_EXT_BUS_BYTE_SIZE / MaliGpuCy, 1"})
  void testCardinality(String equation, int errors) {
    HWCSpec spec = threeDomains().derivedCounter("MaliDerived", 3, equation).buildSpec();
    CheckResult result = new SpecDRC(spec).checkEquationCardinality("Mali-G710");
    Assertions.assertEquals(errors, result.errorCount(), () -> result.diagnostics().toString());
    Assertions.assertEquals(errors, diagnostics(result, DiagnosticKind.CARDINALITY).size());
  }

  @Test
  void testCardinalityExceptions() {
    HWCSpec spec = threeDomains().derivedCounter("MaliFragOverdraw", 3, "MaliFragCy / MaliGpuCy").buildSpec();
    SpecDRC drc = new SpecDRC(spec);
    Assertions.assertTrue(drc.checkEquationCardinality("Mali-G710").isClean());

    drc.setCardinalityRules(CardinalityRules.DEFAULT.withExceptions(Set.of()));
    Assertions.assertEquals(1, drc.checkEquationCardinality("Mali-G710").errorCount());
  }

  @Test
  void testCardinalityUnknownSymbol() {
    HWCSpec spec = threeDomains().derivedCounter("MaliDerived", 3, "MaliFragCy / MaliGpuCy * MALI_CONFIG_FOO").buildSpec();
    CheckResult result = new SpecDRC(spec).checkEquationCardinality("Mali-G710");
    Assertions.assertEquals(1, diagnostics(result, DiagnosticKind.UNKNOWN_SYMBOL).size());
    Assertions.assertEquals("MALI_CONFIG_FOO", diagnostics(result, DiagnosticKind.UNKNOWN_SYMBOL).get(0).detail().orElseThrow());
    Assertions.assertEquals(1, diagnostics(result, DiagnosticKind.CARDINALITY).size());
  }

  @Test
  void testCardinalityThroughDerivedCounters() {
    // The check works on the expanded equation
    HWCSpec spec = threeDomains().derivedCounter("MaliScaled", 3, "MaliFragCy * 2").derivedCounter("MaliRatio", 4, "MaliScaled / MaliGpuCy").buildSpec();
    CheckResult result = new SpecDRC(spec).checkEquationCardinality("Mali-G710");
    Assertions.assertEquals(List.of("MaliRatio"), result.diagnostics().stream().map(Diagnostic::subject).toList());
  }

  @Test
  void testEquationResolve() {
    HWCSpec spec = threeDomains().derivedCounter("MaliDangling", 3, "MaliFragCy / Missing").derivedCounter("MaliBroken", 4, "MaliFragCy / (MaliGpuCy").buildSpec();
    SpecDRC drc = new SpecDRC(spec);
    CheckResult resolve = drc.checkEquationResolve("Mali-G710");
    Assertions.assertEquals(List.of("MaliDangling"), resolve.diagnostics().stream().map(Diagnostic::subject).toList());
    Assertions.assertEquals("Missing counter: Missing", resolve.diagnostics().get(0).detail().orElseThrow());

    CheckResult parse = drc.checkEquationParse();
    Assertions.assertEquals(List.of("MaliBroken"), parse.diagnostics().stream().map(Diagnostic::subject).toList());
    Assertions.assertEquals(DiagnosticKind.EQUATION_PARSE, parse.diagnostics().get(0).kind());
  }

  @Test
  void testSemanticLayoutCounterMissing() {
    HWCSpec spec = threeDomains().hideFromLayout("MaliMemBt").buildSpec();
    CheckResult result = new SpecDRC(spec).checkSemanticLayout();
    Assertions.assertEquals(1, result.errorCount());
    Diagnostic diagnostic = result.diagnostics().get(0);
    Assertions.assertEquals(DiagnosticKind.DATABASE_EXTRA_COUNTER, diagnostic.kind());
    Assertions.assertEquals("Activity.MaliMemBt", diagnostic.subject());
  }

  @Test
  void testSemanticLayoutExtraCounter() {
    HWCSpec spec = threeDomains().extraLayoutCounter("Activity", "Ghost").buildSpec();
    CheckResult result = new SpecDRC(spec).checkSemanticLayout();
    Assertions.assertEquals(1, result.errorCount());
    Assertions.assertEquals(DiagnosticKind.LAYOUT_EXTRA_COUNTER, result.diagnostics().get(0).kind());
    Assertions.assertEquals("Extra semantic counter in SemanticLayout: Activity.Ghost", result.diagnostics().get(0).toString());
  }

  @Test
  void testSemanticLayoutExtraGroup() {
    HWCSpec spec = threeDomains().extraLayoutCounter("Unused", "Ghost").buildSpec();
    CheckResult result = new SpecDRC(spec).checkSemanticLayout();
    Assertions.assertEquals(1, diagnostics(result, DiagnosticKind.LAYOUT_EXTRA_GROUP).size());
    Assertions.assertEquals(1, diagnostics(result, DiagnosticKind.LAYOUT_EXTRA_COUNTER).size());
  }

  @Test
  void testStableIdAssignment() {
    HWCSpec spec = new TestDatabaseBuilder()
                       .product("Mali-G710")
                       .block("Mali-G710", HardwareBlockType.SHADER_CORE, "S0", "S1", "S2", "S3")
                       .nativeCounter("A", 0, "S0")
                       .nativeCounter("B", null, "S1")
                       .nativeCounter("C", 2, "S2")
                       .nativeCounter("D", null, "S3")
                       .buildSpec();
    SpecDRC drc = new SpecDRC(spec);
    CheckResult first = drc.checkStableIds();
    Assertions.assertEquals(List.of("suggest 1", "suggest 3"),
                            first.diagnostics().stream().map(diagnostic -> diagnostic.detail().orElseThrow()).toList());
    Assertions.assertEquals(List.of(DiagnosticKind.STABLE_ID_MISSING, DiagnosticKind.STABLE_ID_MISSING),
                            first.diagnostics().stream().map(Diagnostic::kind).toList());

    Assertions.assertTrue(drc.checkStableIds().isClean());
    // The assigned IDs make the product compile
    Assertions.assertEquals(4, spec.getIndexedViewFor("Mali-G710").size());
    Assertions.assertEquals("D", spec.getIndexedViewFor("Mali-G710").getByStableId(3).orElseThrow().getMachineName());
  }

  @Test
  void testStableIdReuse() {
    HWCSpec spec = threeDomains().nativeCounter("MaliReused", 1, "FRAG_ACTIVE").buildSpec();
    CheckResult result = new SpecDRC(spec).checkStableIds();
    Assertions.assertEquals(1, result.errorCount());
    Assertions.assertEquals("Stable ID reused for a different Machine Name", result.diagnostics().get(0).reason());
  }

  @Test
  void testStableIdPerName() {
    HWCSpec spec = new TestDatabaseBuilder()
                       .product("Mali-G710")
                       .product("Mali-G72")
                       .block("Mali-G710", HardwareBlockType.SHADER_CORE, "FRAG_ACTIVE")
                       .block("Mali-G72", HardwareBlockType.SHADER_CORE, "FRAG_ACTIVE")
                       .nativeCounter("A", 0, "FRAG_ACTIVE")
                       .onlyFor("Mali-G72")
                       .nativeCounter("A", 1, "FRAG_ACTIVE")
                       .onlyFor("Mali-G710")
                       .buildSpec();
    CheckResult result = new SpecDRC(spec).checkStableIds();
    Assertions.assertEquals(1, result.errorCount());
    Assertions.assertEquals("Machine Name alias using a different Stable ID", result.diagnostics().get(0).reason());
  }

  @Test
  void testMissingStableIdReusesNamedId() {
    HWCSpec spec = new TestDatabaseBuilder()
                       .product("Mali-G710")
                       .product("Mali-G72")
                       .block("Mali-G710", HardwareBlockType.SHADER_CORE, "FRAG_ACTIVE")
                       .block("Mali-G72", HardwareBlockType.SHADER_CORE, "FRAG_ACTIVE")
                       .nativeCounter("A", 5, "FRAG_ACTIVE")
                       .onlyFor("Mali-G72")
                       .nativeCounter("A", null, "FRAG_ACTIVE")
                       .onlyFor("Mali-G710")
                       .buildSpec();
    CheckResult result = new SpecDRC(spec).checkStableIds();
    Assertions.assertEquals("suggest 5", result.diagnostics().get(0).detail().orElseThrow());
    for (CounterInfo counter : spec.getDatabase().counters())
      Assertions.assertEquals(5, counter.getStableId().getAsInt());
  }

  @ParameterizedTest
  @CsvSource({"'', 0", "0, 1", "'0,1,2', 3", "'0,2', 1", "'1,2', 0"})
  void testLowestUnusedId(String used, int expected) {
    Set<Integer> ids = used.isEmpty() ? Set.of() : Set.copyOf(List.of(used.split(",")).stream().map(Integer::valueOf).toList());
    Assertions.assertEquals(expected, SpecDRC.lowestUnusedId(ids));
  }

  @Test
  void testUnits() {
    HWCSpec spec = threeDomains()
                       .derivedCounter("MaliWidgets", 3, "MaliFragCy / MaliGpuCy", "widgets")
                       .derivedCounter("MaliUtil", 4, "MaliFragCy / MaliGpuCy", "percent")
                       .buildSpec();
    CheckResult result = new SpecDRC(spec).checkUnits();
    Assertions.assertEquals(List.of("MaliWidgets"), result.diagnostics().stream().map(Diagnostic::subject).toList());
  }

  @Test
  void testAssignedIdsLetProductChecksRun() {
    HWCSpec spec = threeDomains().nativeCounter("MaliUnplaced", null, "NOWHERE").buildSpec();
    Map<DiagnosticKind, Long> kinds = SpecDRC.countByKind(new SpecDRC(spec).runAll());
    Assertions.assertEquals(Map.of(DiagnosticKind.STABLE_ID_MISSING, 1L, DiagnosticKind.SOURCE_NAME_MISMATCH, 1L), kinds);
  }
}
