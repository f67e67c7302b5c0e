package hwcspec.drc;

import java.util.Optional;

/**
 * One validation finding.
 * @param kind the category, for tools processing the results
 * @param product the database key the finding applies to, empty for database-wide checks
 * @param subject the affected counter, section or group
 * @param reason human-readable description
 * @param detail additional information, e.g. a parser message
 */
public record Diagnostic(DiagnosticKind kind, Optional<String> product, String subject, String reason, Optional<String> detail) {

  public static Diagnostic of(DiagnosticKind kind, String subject, String reason) {
    return new Diagnostic(kind, Optional.empty(), subject, reason, Optional.empty());
  }

  public static Diagnostic of(DiagnosticKind kind, String subject, String reason, String detail) {
    return new Diagnostic(kind, Optional.empty(), subject, reason, Optional.of(detail));
  }

  public static Diagnostic forProduct(DiagnosticKind kind, String product, String subject, String reason) {
    return new Diagnostic(kind, Optional.of(product), subject, reason, Optional.empty());
  }

  public static Diagnostic forProduct(DiagnosticKind kind, String product, String subject, String reason, String detail) {
    return new Diagnostic(kind, Optional.of(product), subject, reason, Optional.of(detail));
  }

  @Override
  public String toString() {
    return reason + ": " + product.map(gpu -> gpu + " ").orElse("") + subject + detail.map(text -> " (" + text + ")").orElse("");
  }
}
