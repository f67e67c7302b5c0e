package hwcspec.doc;

import hwcspec.HWCSpec;
import hwcspec.SpecConsistencyException;
import hwcspec.view.IndexedView;
import java.io.File;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DocReferencesTest {

  private HWCSpec spec;

  @BeforeEach
  void setUp() throws Exception {
    spec = HWCSpec.load(new File("testdata/hwcspec/database"));
  }

  private String resolve(String product, String text) {
    IndexedView view = spec.getIndexedViewFor(product);
    return DocReferences.resolveToText(text, view, spec.getProductInfoFor(product));
  }

  @Test
  void testParse() {
    List<DocReference> references = DocReferences.parse("Uses {{C::MaliFragUtil.equation}} on {{K::GPU_NAME}} and {{bogus}}.");
    Assertions.assertEquals(List.of(new DocReference("{{C::MaliFragUtil.equation}}", "C", "MaliFragUtil", "equation"),
                                    new DocReference("{{K::GPU_NAME}}", "K", "GPU_NAME", ""),
                                    new DocReference("{{bogus}}", "bogus", "", "")),
                            references);
    Assertions.assertTrue(references.get(0).isCounter());
    Assertions.assertTrue(references.get(1).isConstant());
    Assertions.assertEquals("K::GPU_NAME", references.get(1).body());
    Assertions.assertTrue(DocReferences.parse("No references here.").isEmpty());
  }

  @Test
  void testResolveCounterAndProduct() {
    String text = spec.getDatabase().counters().stream()
                      .filter(counter -> counter.getMachineName().equals("MaliFragUtil"))
                      .findFirst().orElseThrow().getLongDescription();
    Assertions.assertEquals("This expression defines the fragment utilization of Mali-G72, based on Fragment active cycles.",
                            resolve("Mali-G72", text));
    // Aliases without their own document use the name of the primary product
    Assertions.assertEquals("This expression defines the fragment utilization of Mali-G710, based on Fragment active cycles.",
                            resolve("Mali-G610", text));
  }

  @Test
  void testResolveEquation() {
    String group = spec.getSemanticViewFor("Mali-G72").groups()
                       .filter(view -> view.name().equals("Utilization"))
                       .findFirst().orElseThrow().longDescription();
    String text = resolve("Mali-G72", group);
    Assertions.assertTrue(text.startsWith("Utilization is computed as "), text);
    Assertions.assertTrue(text.contains("MaliFragActiveCy / MALI_CONFIG_SHADER_CORE_COUNT"), text);
    Assertions.assertFalse(text.contains("{{"), text);
  }

  @Test
  void testTextWithoutReferences() {
    Assertions.assertEquals("Plain $text with \\ specials.", resolve("Mali-G72", "Plain $text with \\ specials."));
  }

  @ParameterizedTest
  @ValueSource(strings = {"{{C::MaliMissing}}", "{{C::MaliEngInstr.equation}}", "{{C::MaliFragUtil.source}}", "{{K::GPU_ID}}",
                          "{{K::GPU_NAME.short}}", "{{X::MaliFragUtil}}", "{{bogus}}"})
  void testBadReference(String text) {
    Assertions.assertThrows(SpecConsistencyException.class, () -> resolve("Mali-G72", text));
  }
}
