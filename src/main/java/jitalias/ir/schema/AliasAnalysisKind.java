package jitalias.ir.schema;

/** How the alias analysis treats an operator that has no dedicated analyzer. */
public enum AliasAnalysisKind {
  /** Follow the alias annotations of the schema. */
  FROM_SCHEMA,
  /** Outputs are fresh and nothing is written, whatever the annotations say. */
  PURE
}
