package jitalias.ir.schema;

import java.util.Objects;
import java.util.Optional;
import jitalias.ir.types.Type;
import org.jetbrains.annotations.Nullable;

/** A formal argument or return of a {@link FunctionSchema}. */
public final class Argument {

  public final String name;
  public final Type type;
  @Nullable private final AliasInfo aliasInfo;

  public Argument(String name, Type type, @Nullable AliasInfo aliasInfo) {
    this.name = name;
    this.type = type;
    this.aliasInfo = aliasInfo;
  }

  public Argument(String name, Type type) {
    this(name, type, null);
  }

  public Optional<AliasInfo> aliasInfo() {
    return Optional.ofNullable(aliasInfo);
  }

  @Override
  public String toString() {
    String annotated = aliasInfo == null ? type.toString() : type + aliasInfo.toString();
    return name.isEmpty() ? annotated : annotated + " " + name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Argument argument = (Argument) o;
    return Objects.equals(name, argument.name)
        && Objects.equals(type, argument.type)
        && Objects.equals(aliasInfo, argument.aliasInfo);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, aliasInfo);
  }
}
