package jitalias.ir.alias;

import java.util.Optional;
import jitalias.ir.Value;
import jitalias.ir.types.Type;
import jitalias.ir.types.TypeKind;

/**
 * Decides which values have an observable identity and are thus tracked by the alias analysis.
 *
 * <p>The returned kind doubles as key of the wildcard buckets: all wildcard values of the same kind
 * alias each other. More granularity is possible (a {@code int[]} never aliases a {@code float[]}),
 * as long as every value still ends up in a bucket that over-approximates its aliases.
 */
public class MutableTypes {

  private MutableTypes() {}

  public static Optional<TypeKind> mutableKind(Type type) {
    if (type.isTensor()) {
      return Optional.of(TypeKind.TENSOR);
    }
    switch (type.kind()) {
      case LIST:
      case TUPLE:
      case DICT:
      case CLASS:
        return Optional.of(type.kind());
      case OPTIONAL:
      case FUTURE:
        return mutableKind(type.getElementType());
      default:
        return Optional.empty();
    }
  }

  public static boolean shouldAnnotate(Type type) {
    return mutableKind(type).isPresent();
  }

  public static boolean shouldAnnotate(Value value) {
    return shouldAnnotate(value.type());
  }

  /** Can values of this type contain other values, looking through Optional and Future? */
  public static boolean isContainerType(Type type) {
    if (type.kind() == TypeKind.OPTIONAL || type.kind() == TypeKind.FUTURE) {
      return isContainerType(type.getElementType());
    }
    return !type.containedTypes().isEmpty();
  }
}
