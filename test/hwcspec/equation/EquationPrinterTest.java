package hwcspec.equation;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class EquationPrinterTest {

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {
    "a+b+c               | a + b + c",
    "(a + b) * c         | (a + b) * c",
    "a * b / c           | (a * b) / c",
    "a / b / c           | a / b / c",
    "a + b * c           | a + (b * c)",
    "a * 1               | a",
    "a / 1               | a",
    "1 * a               | a",
    "1 / a               | 1 / a",
    "2 * 3               | 6",
    "1 / 4               | 0.25",
    "1.50 * 2            | 3",
    "a * 2 * 4           | a * 8",
    "a * 2 / 4           | (a * 2) / 4",
    "a * 2 * 0.5         | a",
    "a * 2 * (3 * b)     | a * 6 * b",
    "a * (b * 2) * 3     | a * b * 6",
    "a * (1 * (b * c))   | a * b * c",
    "1 / 0               | 1 / 0",
    "max(min(a, 100), 0) | max(min(a, 100), 0)",
    "min(a*1, b)         | min(a, b)"
  })
  void testPrint(String text, String expected) throws EquationSyntaxException {
    Assertions.assertEquals(expected, EquationPrinter.print(EquationParser.parse(text)));
  }

  @Test
  void testSameOperatorChainsPrintFlat() throws EquationSyntaxException {
    // Operands with the parent's operator are never parenthesized
    Assertions.assertEquals("a - b - c", EquationPrinter.print(EquationParser.parse("a - (b - c)")));
  }

  @ParameterizedTest
  @ValueSource(strings = {"(MaliFragActiveCy / MALI_CONFIG_SHADER_CORE_COUNT) / MaliGPUActiveCy * 100", "a * 2 * 4 + b / 1",
                          "max(min(x - y, 100), 0) * 3 * 7", "(a + b) * (c - d) / (e * f)", "0.5 * 0.5 * q",
                          "a * 2 * 0.5", "a * 2 * (3 * b)", "a * (b * 2) * 3", "x / (y / 1) * 4 * 0.25", "a - (b - c)",
                          "a * (0.5 * (4 * b)) / 2"})
  void testIdempotent(String text) throws EquationSyntaxException {
    String once = EquationPrinter.print(EquationParser.parse(text));
    String twice = EquationPrinter.print(EquationParser.parse(once));
    Assertions.assertEquals(once, twice);
  }

  @Test
  void testToLiteral() {
    Assertions.assertEquals("8", EquationPrinter.toLiteral(8.0));
    Assertions.assertEquals("0.125", EquationPrinter.toLiteral(0.125));
    Assertions.assertEquals("-3", EquationPrinter.toLiteral(-3.0));
  }
}
