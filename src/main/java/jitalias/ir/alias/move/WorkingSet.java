package jitalias.ir.alias.move;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Set;
import jitalias.ir.Node;
import jitalias.ir.Value;
import jitalias.ir.alias.AliasDb;
import jitalias.ir.types.TypeKind;
import jitalias.ir.utils.NodeUtils;

/**
 * The nodes that have to move together with a node, because they depend on it or it depends on
 * them.
 *
 * <p>Tracks the users, writes and reads of all its nodes as multisets, so that the first node (the
 * mover) can be taken out again.
 */
public class WorkingSet {

  private final AliasDb aliasDb;
  private final Deque<Node> nodes = new ArrayDeque<>();
  /** Users of the nodes' outputs, attributed to the nodes' block. */
  private final Multiset<Node> users = HashMultiset.create();
  private final Multiset<Value> writes = HashMultiset.create();
  private final Multiset<Value> reads = HashMultiset.create();
  private final Multiset<TypeKind> wildcardWrites = EnumMultiset.create(TypeKind.class);

  public WorkingSet(Node mover, AliasDb aliasDb) {
    this.aliasDb = aliasDb;
    add(mover);
  }

  public void add(Node n) {
    nodes.addLast(n);
    users.addAll(NodeUtils.getUsersSameBlock(n));
    writes.addAll(aliasDb.getWrites(n, true));
    reads.addAll(aliasDb.getReads(n, true));
    wildcardWrites.addAll(aliasDb.getWildcardWrites(n, true));
  }

  /** Removes the node the working set was created for, along with everything it contributed. */
  public void eraseMover() {
    Node mover = nodes.removeFirst();
    for (Node user : NodeUtils.getUsersSameBlock(mover)) {
      users.remove(user);
    }
    for (Value write : aliasDb.getWrites(mover, true)) {
      writes.remove(write);
    }
    for (Value read : aliasDb.getReads(mover, true)) {
      reads.remove(read);
    }
    for (TypeKind kind : aliasDb.getWildcardWrites(mover, true)) {
      wildcardWrites.remove(kind);
    }
  }

  /** In the order they were added. */
  public Iterable<Node> nodes() {
    return Collections.unmodifiableCollection(nodes);
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  /** Does the working set depend on {@code n}, or {@code n} on the working set? */
  public boolean dependsOn(Node n) {
    if (nodes.isEmpty()) {
      return false;
    }
    return hasDataDependency(n) || hasMutabilityDependency(n);
  }

  private boolean hasDataDependency(Node n) {
    if (n.isAfter(nodes.getFirst())) {
      return producesFor(n);
    }
    return consumesFrom(n);
  }

  /** Does {@code n} use a value produced by the working set? */
  private boolean producesFor(Node n) {
    return users.contains(n);
  }

  /** Does the working set use a value produced by {@code n}? */
  private boolean consumesFrom(Node n) {
    Set<Node> usersOfN = NodeUtils.getUsersSameBlock(n);
    for (Node node : nodes) {
      if (usersOfN.contains(node)) {
        return true;
      }
    }
    return false;
  }

  /** Does {@code n} write to something the working set reads, or vice versa? */
  private boolean hasMutabilityDependency(Node n) {
    Set<Value> nWrites = aliasDb.getWrites(n, true);
    Set<Value> nReads = aliasDb.getReads(n, true);
    Set<TypeKind> nWildcardWrites = aliasDb.getWildcardWrites(n, true);
    return aliasDb.mayAlias(nWrites, reads.elementSet())
        || aliasDb.mayAlias(writes.elementSet(), nReads)
        || aliasDb.mayAliasWildcard(reads.elementSet(), nWildcardWrites)
        || aliasDb.mayAliasWildcard(nReads, wildcardWrites.elementSet());
  }

  @Override
  public String toString() {
    return "WorkingSet{" + "nodes=" + nodes + '}';
  }
}
