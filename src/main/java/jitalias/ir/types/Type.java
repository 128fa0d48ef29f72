package jitalias.ir.types;

import static org.jooq.lambda.Seq.seq;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A type of the IR's type lattice. Types are immutable and compared structurally, except for class
 * types, which are compared by name.
 */
public final class Type {

  public static final Type TENSOR = new Type(TypeKind.TENSOR, ImmutableList.of(), null);
  public static final Type DIMENSIONED_TENSOR =
      new Type(TypeKind.DIMENSIONED_TENSOR, ImmutableList.of(), null);
  public static final Type COMPLETE_TENSOR =
      new Type(TypeKind.COMPLETE_TENSOR, ImmutableList.of(), null);
  public static final Type INT = new Type(TypeKind.INT, ImmutableList.of(), null);
  public static final Type FLOAT = new Type(TypeKind.FLOAT, ImmutableList.of(), null);
  public static final Type BOOL = new Type(TypeKind.BOOL, ImmutableList.of(), null);
  public static final Type STRING = new Type(TypeKind.STRING, ImmutableList.of(), null);
  public static final Type NUMBER = new Type(TypeKind.NUMBER, ImmutableList.of(), null);
  public static final Type NONE = new Type(TypeKind.NONE, ImmutableList.of(), null);

  private final TypeKind kind;
  private final ImmutableList<Type> containedTypes;
  /** Only set for class types. */
  @Nullable private final String className;

  private Type(TypeKind kind, ImmutableList<Type> containedTypes, @Nullable String className) {
    this.kind = kind;
    this.containedTypes = containedTypes;
    this.className = className;
  }

  public static Type tensor() {
    return TENSOR;
  }

  public static Type listOf(Type elementType) {
    return new Type(TypeKind.LIST, ImmutableList.of(elementType), null);
  }

  public static Type tupleOf(Type... elementTypes) {
    return tupleOf(ImmutableList.copyOf(elementTypes));
  }

  public static Type tupleOf(List<Type> elementTypes) {
    return new Type(TypeKind.TUPLE, ImmutableList.copyOf(elementTypes), null);
  }

  public static Type dictOf(Type keyType, Type valueType) {
    return new Type(TypeKind.DICT, ImmutableList.of(keyType, valueType), null);
  }

  public static Type optionalOf(Type elementType) {
    return new Type(TypeKind.OPTIONAL, ImmutableList.of(elementType), null);
  }

  public static Type futureOf(Type elementType) {
    return new Type(TypeKind.FUTURE, ImmutableList.of(elementType), null);
  }

  public static Type classType(String name) {
    Preconditions.checkNotNull(name, "class types need a name");
    return new Type(TypeKind.CLASS, ImmutableList.of(), name);
  }

  public TypeKind kind() {
    return kind;
  }

  public List<Type> containedTypes() {
    return containedTypes;
  }

  /** The element type of Optional, Future and List types. */
  public Type getElementType() {
    Preconditions.checkState(
        kind == TypeKind.OPTIONAL || kind == TypeKind.FUTURE || kind == TypeKind.LIST,
        "%s has no element type",
        this);
    return containedTypes.get(0);
  }

  public boolean isTensor() {
    return isSubtypeOf(TENSOR);
  }

  public boolean isSubtypeOf(Type other) {
    if (this.equals(other)) {
      return true;
    }
    switch (other.kind) {
      case TENSOR:
        return kind == TypeKind.DIMENSIONED_TENSOR || kind == TypeKind.COMPLETE_TENSOR;
      case DIMENSIONED_TENSOR:
        return kind == TypeKind.COMPLETE_TENSOR;
      case OPTIONAL:
        if (kind == TypeKind.NONE) {
          return true;
        }
        Type otherElement = other.getElementType();
        if (kind == TypeKind.OPTIONAL) {
          return getElementType().isSubtypeOf(otherElement);
        }
        return isSubtypeOf(otherElement);
      case NUMBER:
        return kind == TypeKind.INT || kind == TypeKind.FLOAT;
      case TUPLE:
        return kind == TypeKind.TUPLE
            && containedTypes.size() == other.containedTypes.size()
            && seq(containedTypes).zip(other.containedTypes).allMatch(t -> t.v1.isSubtypeOf(t.v2));
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    switch (kind) {
      case TENSOR:
        return "Tensor";
      case DIMENSIONED_TENSOR:
        return "DimensionedTensor";
      case COMPLETE_TENSOR:
        return "CompleteTensor";
      case LIST:
        return containedTypes.get(0) + "[]";
      case TUPLE:
        return "Tuple[" + seq(containedTypes).toString(", ") + "]";
      case DICT:
        return "Dict[" + containedTypes.get(0) + ", " + containedTypes.get(1) + "]";
      case CLASS:
        return className;
      case FUTURE:
        return "Future[" + containedTypes.get(0) + "]";
      case OPTIONAL:
        return "Optional[" + containedTypes.get(0) + "]";
      case INT:
        return "int";
      case FLOAT:
        return "float";
      case BOOL:
        return "bool";
      case STRING:
        return "str";
      case NUMBER:
        return "Scalar";
      case NONE:
        return "None";
      default:
        throw new AssertionError("Unhandled type kind " + kind);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Type type = (Type) o;
    return kind == type.kind
        && Objects.equals(containedTypes, type.containedTypes)
        && Objects.equals(className, type.className);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, containedTypes, className);
  }
}
