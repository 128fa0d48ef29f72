package jitalias.ir.schema;

import static org.jooq.lambda.Seq.seq;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import jitalias.ir.Symbol;

/**
 * The alias annotation of a schema argument or return, e.g. {@code Tensor(a!)}.
 *
 * <p>An annotation names the formal alias sets the value belongs to before the call and after the
 * call, and whether the operator writes to it. The wildcard set {@code *} stands for "may alias
 * anything of this kind". {@code Tensor(a -> *)} means the argument starts out in set {@code a} and
 * leaks into the wildcard set during the call.
 */
public final class AliasInfo {

  public static final Symbol WILDCARD_SET = Symbol.alias("*");

  private final ImmutableSet<Symbol> beforeSets;
  private final ImmutableSet<Symbol> afterSets;
  private final boolean isWrite;
  /** Annotations of contained types, as in {@code Tensor(a)[]}. */
  private final ImmutableList<AliasInfo> containedTypes;

  private AliasInfo(
      Set<Symbol> beforeSets,
      Set<Symbol> afterSets,
      boolean isWrite,
      List<AliasInfo> containedTypes) {
    Preconditions.checkArgument(!beforeSets.isEmpty(), "alias annotation without before sets");
    this.beforeSets = ImmutableSet.copyOf(beforeSets);
    this.afterSets = ImmutableSet.copyOf(afterSets);
    this.isWrite = isWrite;
    this.containedTypes = ImmutableList.copyOf(containedTypes);
  }

  /** {@code (a)} */
  public static AliasInfo of(String set) {
    return builder().before(set).build();
  }

  /** {@code (a!)} */
  public static AliasInfo write(String set) {
    return builder().before(set).write().build();
  }

  /** {@code (a|b)} */
  public static AliasInfo union(String... sets) {
    Builder builder = builder();
    for (String set : sets) {
      builder.before(set);
    }
    return builder.build();
  }

  /** {@code (*)} */
  public static AliasInfo wildcard() {
    return builder().before(WILDCARD_SET).build();
  }

  /** {@code (a -> *)} */
  public static AliasInfo leaksToWildcard(String set) {
    return builder().before(set).after(WILDCARD_SET).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Set<Symbol> beforeSets() {
    return beforeSets;
  }

  public Set<Symbol> afterSets() {
    return afterSets;
  }

  /** The single before set. Only valid if there is exactly one. */
  public Symbol beforeSet() {
    Preconditions.checkState(
        beforeSets.size() == 1, "%s has more than one before set", this);
    return beforeSets.iterator().next();
  }

  public boolean isWrite() {
    return isWrite;
  }

  public List<AliasInfo> containedTypes() {
    return containedTypes;
  }

  public boolean isWildcardBefore() {
    return beforeSets.contains(WILDCARD_SET);
  }

  public boolean isWildcardAfter() {
    return afterSets.contains(WILDCARD_SET);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(");
    sb.append(seq(beforeSets).map(s -> s.name).toString("|"));
    if (!afterSets.equals(beforeSets)) {
      sb.append(" -> ").append(seq(afterSets).map(s -> s.name).toString("|"));
    }
    if (isWrite) {
      sb.append("!");
    }
    sb.append(")");
    for (AliasInfo contained : containedTypes) {
      sb.append(contained);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AliasInfo that = (AliasInfo) o;
    return isWrite == that.isWrite
        && Objects.equals(beforeSets, that.beforeSets)
        && Objects.equals(afterSets, that.afterSets)
        && Objects.equals(containedTypes, that.containedTypes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(beforeSets, afterSets, isWrite, containedTypes);
  }

  public static class Builder {
    private final ImmutableSet.Builder<Symbol> beforeSets = ImmutableSet.builder();
    private final ImmutableSet.Builder<Symbol> afterSets = ImmutableSet.builder();
    private final ImmutableList.Builder<AliasInfo> containedTypes = ImmutableList.builder();
    private boolean hasAfterSets = false;
    private boolean isWrite = false;

    private Builder() {}

    public Builder before(String set) {
      return before(set.equals("*") ? WILDCARD_SET : Symbol.alias(set));
    }

    public Builder before(Symbol set) {
      beforeSets.add(set);
      return this;
    }

    /** If no after set is given, the after sets equal the before sets. */
    public Builder after(String set) {
      return after(set.equals("*") ? WILDCARD_SET : Symbol.alias(set));
    }

    public Builder after(Symbol set) {
      hasAfterSets = true;
      afterSets.add(set);
      return this;
    }

    public Builder write() {
      isWrite = true;
      return this;
    }

    public Builder contained(AliasInfo containedType) {
      containedTypes.add(containedType);
      return this;
    }

    public AliasInfo build() {
      ImmutableSet<Symbol> before = beforeSets.build();
      ImmutableSet<Symbol> after = hasAfterSets ? afterSets.build() : before;
      return new AliasInfo(before, after, isWrite, containedTypes.build());
    }
  }
}
