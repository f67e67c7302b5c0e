package hwcspec.data;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SpecDatabTest {

  static final File DATABASE = new File("testdata/hwcspec/database");

  private SpecDatabase database;

  @BeforeEach
  void setUp() throws Exception {
    database = new SpecDatab(DATABASE).load();
  }

  @Test
  void testProducts() {
    ProductInfos products = database.products();
    Assertions.assertEquals(List.of("Mali-G72", "Mali-G710", "Mali-G610"), products.getGpus());
    Assertions.assertEquals(List.of("Mali-G72", "Mali-G710"), products.getDatabaseKeys());

    ProductInfo g72 = products.getGpu("Mali-G72");
    Assertions.assertEquals(List.of(0x6001), g72.getIds());
    Assertions.assertEquals(ProductArchitecture.BIFROST, g72.getArchitecture());
    Assertions.assertEquals(Optional.of("Heimdall"), g72.getEngineeringName());

    ProductInfo g610 = products.getGpu("Mali-G610");
    Assertions.assertEquals("Mali-G710", g610.getDatabaseKey());
    Assertions.assertTrue(g610.hasFeature(ProductInfo.FEATURE_ASYNC_CLOCK));
    Assertions.assertEquals(Optional.empty(), g610.getDocumentName(false));
    Assertions.assertEquals(Optional.of("Mali-G710"), g610.getDocumentName(true));
    Assertions.assertEquals("Mali-G710", products.getGpuDocumentationPrimary("Mali-G610").getName());
    Assertions.assertEquals(List.of("Mali-G710", "Mali-G610"), products.getAliasesFor("Mali-G610"));
  }

  @Test
  void testCounters() {
    CounterInfos counters = database.counters();
    Assertions.assertEquals(9, counters.size());
    Assertions.assertEquals(List.of("front-end.yaml", "memory.yaml", "shader-core.yaml"), List.copyOf(counters.bySourceFile().keySet()));

    CounterInfo instr = counters.stream().filter(counter -> counter.getMachineName().equals("MaliEngInstr")).findAny().get();
    var hardware = Assertions.assertInstanceOf(CounterDefinition.Hardware.class, instr.getDefinition());
    Assertions.assertEquals(List.of("EXEC_INSTR_COUNT", "EXEC_INSTR_FMA"), hardware.sourceNames());
    Assertions.assertEquals(CounterVisibility.ADVANCED_APPLICATION, instr.getVisibility());
    // gpu_support is kept in presentation order
    Assertions.assertEquals(List.of("Mali-G72", "Mali-G710"), instr.getGpuSupport());

    CounterInfo util = counters.stream().filter(counter -> counter.getMachineName().equals("MaliFragUtil")).findAny().get();
    Assertions.assertTrue(util.isDerived());
    Assertions.assertTrue(util.getEquation().get().isValid());
    Assertions.assertEquals(5, util.getStableId().getAsInt());
  }

  @Test
  void testHardwareLayouts() {
    HardwareLayout g72 = database.hardwareLayouts().getGpu("Mali-G72");
    Assertions.assertEquals(5, g72.blocks().size());
    Assertions.assertEquals(4, g72.primaryBlocks().count());

    HardwareLayout g710 = database.hardwareLayouts().getGpu("Mali-G710");
    var l2 = g710.getCounterByName("L2_RD_BEATS").get();
    Assertions.assertEquals(HardwareBlockType.MEMORY_SYSTEM, l2.block().type());
    Assertions.assertEquals(16, l2.counter().index());
    Assertions.assertEquals(4, l2.counter().scaleMultiplier());
    // Index defaults to the position in the block
    Assertions.assertEquals(1, g72.getCounterByName("JS0_JOBS").get().counter().index());
  }

  @Test
  void testSemanticDatabases() throws MissingDocumentationException {
    Assertions.assertEquals(3, database.semanticLayout().sections().size());
    Assertions.assertEquals(5, database.semanticLayout().groups().count());
    Assertions.assertEquals("Performance counters give an overview of GPU activity.",
                            database.sectionInfos().getInfoFor("Mali-G72", "Performance").longDescription());
    Assertions.assertTrue(database.sectionInfos().getInfoFor("Mali-G710", "Performance").longDescription().contains("both clock domains"));
    Assertions.assertThrows(MissingDocumentationException.class, () -> database.groupInfos().getInfoFor("Mali-G72", "Nonexistent"));
    Assertions.assertEquals("Valhall with a dedicated shader core clock domain.",
                            database.architectures().getInfoFor("Mali-G710", ProductArchitecture.VALHALL).longDescription());
  }

  private static File copyDatabase(Path tempDir) throws IOException {
    File root = tempDir.resolve("database").toFile();
    for (File file : Files.walk(DATABASE.toPath()).map(Path::toFile).toList()) {
      File target = new File(root, DATABASE.toPath().relativize(file.toPath()).toString());
      if (file.isDirectory())
        target.mkdirs();
      else
        Files.copy(file.toPath(), target.toPath());
    }
    return root;
  }

  @Test
  void testRejectsCounterWithSourceAndEquation(@TempDir Path tempDir) throws IOException {
    File root = copyDatabase(tempDir);
    Files.writeString(new File(root, "counters/bad.yaml").toPath(), String.join("\n",
        "- machine_name: MaliBad",
        "  human_name: Bad",
        "  group_name: Cycles",
        "  group_human_name: Bad",
        "  units: cycles",
        "  trend: Informative",
        "  visibility: Novice",
        "  source: BAD",
        "  equation: MaliGPUActiveCy * 2",
        ""));
    var e = Assertions.assertThrows(SpecFormatException.class, () -> new SpecDatab(root).load());
    Assertions.assertTrue(e.getMessage().startsWith("bad.yaml entry 1"), e.getMessage());
  }

  @Test
  void testRejectsUnknownEnumValue(@TempDir Path tempDir) throws IOException {
    File root = copyDatabase(tempDir);
    Path file = new File(root, "counters/memory.yaml").toPath();
    Files.writeString(file, Files.readString(file).replace("trend: Informative", "trend: Sideways"));
    Assertions.assertThrows(SpecFormatException.class, () -> new SpecDatab(root).load());
  }

  @Test
  void testMissingDirectory(@TempDir Path tempDir) {
    Assertions.assertThrows(SpecFormatException.class, () -> new SpecDatab(tempDir.resolve("nothing").toFile()).load());
  }

  @Test
  void testEquationParseErrorIsKept(@TempDir Path tempDir) throws Exception {
    File root = copyDatabase(tempDir);
    Path file = new File(root, "counters/memory.yaml").toPath();
    Files.writeString(file, Files.readString(file).replace("equation: MaliL2RdBt * MALI_CONFIG_EXT_BUS_BYTE_SIZE", "equation: MaliL2RdBt *"));
    CounterInfo bytes = new SpecDatab(root).load().counters().stream().filter(c -> c.getMachineName().equals("MaliL2RdBy")).findAny().get();
    Assertions.assertFalse(bytes.getEquation().get().isValid());
    Assertions.assertEquals("MaliL2RdBt *", bytes.getEquation().get().error().get().original());
  }
}
