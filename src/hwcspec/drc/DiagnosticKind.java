package hwcspec.drc;

/** Category of a validation finding, one per check family. */
public enum DiagnosticKind {
  WHITESPACE,
  UNEXPECTED_REFERENCE,
  FIELD_LENGTH,
  STABLE_ID_CONFLICT,
  STABLE_ID_MISSING,
  BAD_GPU,
  BAD_UNITS,
  EQUATION_PARSE,
  LAYOUT_DUPLICATE,
  LAYOUT_MISSING_GROUP,
  LAYOUT_EXTRA_SECTION,
  LAYOUT_EXTRA_GROUP,
  LAYOUT_EXTRA_COUNTER,
  DATABASE_EXTRA_COUNTER,
  EXTRA_SEMANTIC_INFO,
  DUPLICATE_NAME,
  SOURCE_NAME_MISMATCH,
  EQUATION_RESOLVE,
  CARDINALITY,
  UNKNOWN_SYMBOL,
  DOC_REFERENCE,
  INCONSISTENT_DATABASE
}
