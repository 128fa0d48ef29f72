package jitalias.ir.alias;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import jitalias.ir.Value;
import org.jetbrains.annotations.Nullable;

/**
 * A vertex of the {@link MemoryDag}, standing for an abstract memory location.
 *
 * <p>Elements are created by and belong to exactly one {@link MemoryDag}, which also maintains all
 * edges. Wildcard buckets are elements without a value.
 */
public final class Element {

  /** Stable index into the owning DAG's arena. */
  public final int index;
  /** The value this element was created for, or null for wildcard buckets. */
  @Nullable public final Value value;

  final Set<Element> pointsTo = new LinkedHashSet<>();
  /** Reverse edges of {@link #pointsTo}. */
  final Set<Element> pointedFrom = new LinkedHashSet<>();
  /** Elements contained in the container this element stands for. */
  final Set<Element> containedElements = new LinkedHashSet<>();

  Element(int index, @Nullable Value value) {
    this.index = index;
    this.value = value;
  }

  public Set<Element> pointsTo() {
    return Collections.unmodifiableSet(pointsTo);
  }

  public Set<Element> pointedFrom() {
    return Collections.unmodifiableSet(pointedFrom);
  }

  public Set<Element> containedElements() {
    return Collections.unmodifiableSet(containedElements);
  }

  public boolean isWildcard() {
    return value == null;
  }

  /** A name for debug output. */
  public String name() {
    return value == null ? "WILDCARD" : value.toString();
  }

  @Override
  public String toString() {
    return "Element{" + index + ", " + name() + '}';
  }
}
