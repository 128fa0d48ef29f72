package jitalias.ir.utils;

import com.google.common.base.Preconditions;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import jitalias.ir.Block;
import jitalias.ir.Node;
import jitalias.ir.Symbols;
import jitalias.ir.Use;
import jitalias.ir.Value;

/** For lack of a better name */
public class NodeUtils {

  /**
   * Traverses {@code target}'s chain of owning nodes upward until we find a node that shares a
   * block with {@code n}.
   *
   * <p>Returns nothing if there is no such node, e.g. because {@code n} is in a nested block and
   * {@code target} is outside. Since nodes are only reordered within a block, {@code target} is
   * irrelevant then.
   */
  public static Optional<Node> findSameBlock(Node target, Node n) {
    Preconditions.checkArgument(
        target.owningGraph() == n.owningGraph(), "%s and %s are in different graphs", target, n);
    Node cur = target;
    while (cur.owningBlock() != n.owningBlock()) {
      cur = cur.owningBlock().owningNode();
      if (cur == null) {
        return Optional.empty();
      }
    }
    return Optional.of(cur);
  }

  /**
   * All users of {@code n}'s outputs, attributed to the node in {@code n}'s block that
   * (transitively) owns the use. So if an If node uses an output of {@code n} in one of its
   * branches, the whole If is a user of {@code n}.
   */
  public static Set<Node> getUsersSameBlock(Node n) {
    Set<Node> users = new LinkedHashSet<>();
    for (Value output : n.outputs()) {
      for (Use use : output.uses()) {
        findSameBlock(use.user, n).ifPresent(users::add);
      }
    }
    return users;
  }

  /** Is {@code block} equal to or nested inside {@code outer}? */
  public static boolean isNestedIn(Block block, Block outer) {
    for (Block cur = block; cur != null; ) {
      if (cur == outer) {
        return true;
      }
      Node owner = cur.owningNode();
      cur = owner == null ? null : owner.owningBlock();
    }
    return false;
  }

  /**
   * Checks that every value used in {@code block} (and its nested blocks) is defined before its
   * use.
   *
   * @return the first offending node, if any
   */
  public static Optional<Node> findUseBeforeDef(Block block) {
    for (Node node : block.nodes()) {
      for (Value input : node.inputs()) {
        if (!isVisibleAt(input, node)) {
          return Optional.of(node);
        }
      }
      for (Block nested : node.blocks()) {
        Optional<Node> offending = findUseBeforeDef(nested);
        if (offending.isPresent()) {
          return offending;
        }
        for (Value output : nested.outputs()) {
          if (!isVisibleAt(output, nested.returnNode())) {
            return Optional.of(node);
          }
        }
      }
    }
    return Optional.empty();
  }

  private static boolean isVisibleAt(Value value, Node user) {
    Node def = value.node();
    if (def.kind().equals(Symbols.PARAM)) {
      return isNestedIn(user.owningBlock(), def.owningBlock());
    }
    if (!def.isInBlockList()) {
      return false;
    }
    if (user.kind().equals(Symbols.RETURN)) {
      // A block's outputs see everything in the block and what its owner sees.
      if (def.owningBlock() == user.owningBlock()) {
        return true;
      }
      Node owner = user.owningBlock().owningNode();
      return owner != null && isVisibleAt(value, owner);
    }
    return findSameBlock(user, def).map(def::isBefore).orElse(false);
  }
}
