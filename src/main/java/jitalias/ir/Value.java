package jitalias.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import jitalias.ir.types.Type;
import jitalias.ir.types.TypeKind;
import org.jetbrains.annotations.Nullable;

/**
 * An SSA value, produced as the {@code offset}-th output of its {@link #node()}. Block inputs are
 * outputs of the block's {@link Symbols#PARAM} node.
 *
 * <p>Values have identity semantics: two values are equal iff they are the same object.
 */
public final class Value {
  private final Node node;
  private final int offset;
  private final int unique;
  private Type type;
  @Nullable private String debugName;
  final List<Use> uses = new ArrayList<>();

  Value(Node node, int offset, Type type, int unique) {
    this.node = node;
    this.offset = offset;
    this.type = type;
    this.unique = unique;
  }

  public Node node() {
    return node;
  }

  public int offset() {
    return offset;
  }

  public Type type() {
    return type;
  }

  public Value setType(Type type) {
    this.type = type;
    return this;
  }

  public List<Use> uses() {
    return Collections.unmodifiableList(uses);
  }

  public boolean hasUses() {
    return !uses.isEmpty();
  }

  public Value setDebugName(String name) {
    this.debugName = name;
    return this;
  }

  public String uniqueName() {
    return debugName != null ? debugName + "." + unique : String.valueOf(unique);
  }

  public Graph owningGraph() {
    return node.owningGraph();
  }

  /** True if this value is statically known to hold None. */
  public boolean mustBeNone() {
    if (type.kind() == TypeKind.NONE) {
      return true;
    }
    return node.kind().equals(Symbols.CONSTANT)
        && !node.hasAttribute(Symbols.ATTR_VALUE)
        && type.kind() == TypeKind.OPTIONAL;
  }

  @Override
  public String toString() {
    return "%" + uniqueName();
  }
}
