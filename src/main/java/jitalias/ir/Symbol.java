package jitalias.ir;

import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * A namespaced name, like {@code aten::add_} or {@code prim::If}. Identifies node kinds, attribute
 * names and the formal alias sets of schemas.
 */
public final class Symbol implements Comparable<Symbol> {

  public static final String ATEN = "aten";
  public static final String PRIM = "prim";
  public static final String ONNX = "onnx";
  public static final String ATTR = "attr";
  public static final String ALIAS = "alias";

  public final String namespace;
  public final String name;

  private Symbol(String namespace, String name) {
    Preconditions.checkArgument(!namespace.isEmpty(), "empty namespace for %s", name);
    Preconditions.checkArgument(!name.isEmpty(), "empty name in namespace %s", namespace);
    this.namespace = namespace;
    this.name = name;
  }

  public static Symbol of(String namespace, String name) {
    return new Symbol(namespace, name);
  }

  public static Symbol aten(String name) {
    return new Symbol(ATEN, name);
  }

  public static Symbol prim(String name) {
    return new Symbol(PRIM, name);
  }

  public static Symbol onnx(String name) {
    return new Symbol(ONNX, name);
  }

  public static Symbol attr(String name) {
    return new Symbol(ATTR, name);
  }

  /** Symbols in the alias namespace name the formal alias sets of schema annotations. */
  public static Symbol alias(String name) {
    return new Symbol(ALIAS, name);
  }

  /** Parses {@code ns::name}. */
  public static Symbol fromQualString(String qualified) {
    int sep = qualified.indexOf("::");
    Preconditions.checkArgument(sep > 0, "%s is not a qualified symbol", qualified);
    return new Symbol(qualified.substring(0, sep), qualified.substring(sep + 2));
  }

  public boolean isAten() {
    return namespace.equals(ATEN);
  }

  public boolean isPrim() {
    return namespace.equals(PRIM);
  }

  public boolean isAttribute() {
    return namespace.equals(ATTR);
  }

  public String toQualString() {
    return namespace + "::" + name;
  }

  @Override
  public String toString() {
    return toQualString();
  }

  @Override
  public int compareTo(Symbol o) {
    int byNamespace = namespace.compareTo(o.namespace);
    return byNamespace != 0 ? byNamespace : name.compareTo(o.name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Symbol symbol = (Symbol) o;
    return namespace.equals(symbol.namespace) && name.equals(symbol.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, name);
  }
}
