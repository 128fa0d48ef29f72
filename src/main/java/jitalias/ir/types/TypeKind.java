package jitalias.ir.types;

public enum TypeKind {
  TENSOR,
  DIMENSIONED_TENSOR,
  COMPLETE_TENSOR,
  LIST,
  TUPLE,
  DICT,
  CLASS,
  FUTURE,
  OPTIONAL,
  INT,
  FLOAT,
  BOOL,
  STRING,
  NUMBER,
  NONE
}
