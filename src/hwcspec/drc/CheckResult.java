package hwcspec.drc;

import java.util.List;

/**
 * Outcome of one check. Every diagnostic counts as one error.
 * @param name the check name
 * @param diagnostics the findings, in discovery order
 */
public record CheckResult(String name, List<Diagnostic> diagnostics) {
  public CheckResult {
    diagnostics = List.copyOf(diagnostics);
  }

  public int errorCount() { return diagnostics.size(); }

  public boolean isClean() { return diagnostics.isEmpty(); }

  public static int totalErrors(List<CheckResult> results) { return results.stream().mapToInt(CheckResult::errorCount).sum(); }
}
