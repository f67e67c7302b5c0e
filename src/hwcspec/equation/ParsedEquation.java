package hwcspec.equation;

import java.util.Optional;

/**
 * An equation as written in the database, together with its AST or its parse error.
 * Exactly one of {@link #ast()} and {@link #error()} is present.
 */
public record ParsedEquation(String text, Optional<EquationNode> ast, Optional<EquationError> error) {
  public ParsedEquation {
    if (ast.isPresent() == error.isPresent())
      throw new IllegalArgumentException("ParsedEquation needs exactly one of ast and error");
  }

  public static ParsedEquation of(String text, EquationNode ast) { return new ParsedEquation(text, Optional.of(ast), Optional.empty()); }

  public static ParsedEquation failed(EquationError error) {
    return new ParsedEquation(error.original(), Optional.empty(), Optional.of(error));
  }

  public boolean isValid() { return ast.isPresent(); }
}
