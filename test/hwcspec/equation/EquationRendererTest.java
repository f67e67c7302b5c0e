package hwcspec.equation;

import hwcspec.HWCSpec;
import hwcspec.view.IndexedView;
import java.io.File;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EquationRendererTest {

  private HWCSpec spec;

  @BeforeEach
  void setUp() throws Exception {
    spec = HWCSpec.load(new File("testdata/hwcspec/database"));
  }

  @Test
  void testPercentClamp() {
    IndexedView view = spec.getIndexedViewFor("Mali-G710");
    var util = view.getByMachineName("MaliFragUtil").get();
    Assertions.assertEquals("max(min((MaliFragActiveCy / MALI_CONFIG_SHADER_CORE_COUNT / MaliGPUActiveCy) * 100, 100), 0)",
                            EquationRenderer.machineNameExpression(view, util));
    Assertions.assertEquals("max(min((FRAG_ACTIVE / MALI_CONFIG_SHADER_CORE_COUNT / GPU_ACTIVE) * 100, 100), 0)",
                            EquationRenderer.sourceNameExpression(view, util));
    Assertions.assertEquals("max(min(($MaliCyclesFragmentActive / $MaliConstantsShaderCoreCount / $MaliCyclesGPUActive) * 100, 100), 0)",
                            EquationRenderer.streamlineExpression(view, util));
  }

  @Test
  void testHardwareNamesFollowProduct() {
    IndexedView g72 = spec.getIndexedViewFor("Mali-G72");
    IndexedView g710 = spec.getIndexedViewFor("Mali-G710");
    Assertions.assertEquals("EXEC_INSTR_COUNT / FRAG_ACTIVE", EquationRenderer.sourceNameExpression(g72, g72.getByMachineName("MaliEngIPC").get()));
    Assertions.assertEquals("EXEC_INSTR_FMA / FRAG_ACTIVE", EquationRenderer.sourceNameExpression(g710, g710.getByMachineName("MaliEngIPC").get()));
  }

  @Test
  void testStreamlineConstants() {
    IndexedView view = spec.getIndexedViewFor("Mali-G72");
    Assertions.assertEquals("$MaliMemoryReadBeats * ($MaliConstantsBusWidthBits / 8)",
                            EquationRenderer.streamlineExpression(view, view.getByMachineName("MaliL2RdBy").get()));
    Assertions.assertEquals("L2_RD_BEATS * MALI_CONFIG_EXT_BUS_BYTE_SIZE",
                            EquationRenderer.sourceNameExpression(view, view.getByMachineName("MaliL2RdBy").get()));
  }

  @Test
  void testStreamlineNativeCounter() {
    IndexedView view = spec.getIndexedViewFor("Mali-G72");
    Assertions.assertEquals("$MaliCyclesGPUActive", EquationRenderer.streamlineExpression(view, view.getByMachineName("MaliGPUActiveCy").get()));
  }

  @Test
  void testUnmappedConstant() {
    var e = Assertions.assertThrows(UnmappedConstantException.class, () -> StreamlineNameRenamer.mangleConstantName("MALI_CONFIG_FOO"));
    Assertions.assertEquals("MALI_CONFIG_FOO", e.getConstant());
  }
}
