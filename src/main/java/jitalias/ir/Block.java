package jitalias.ir;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import jitalias.ir.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * An ordered list of nodes with its own inputs and outputs. A block is either the root block of a
 * {@link Graph} or owned by a node, e.g. the branches of an If.
 *
 * <p>Inputs are the outputs of a {@link Symbols#PARAM} node, outputs are the inputs of a {@link
 * Symbols#RETURN} node. Neither of them is part of the node list.
 */
public final class Block {
  private final Graph graph;
  @Nullable private final Node owningNode;
  private final Node param;
  private final Node ret;
  @Nullable private Node first;
  @Nullable private Node last;

  Block(Graph graph, @Nullable Node owningNode) {
    this.graph = graph;
    this.owningNode = owningNode;
    this.param = new Node(graph, Symbols.PARAM);
    this.ret = new Node(graph, Symbols.RETURN);
    this.param.owningBlock = this;
    this.ret.owningBlock = this;
  }

  public Graph owningGraph() {
    return graph;
  }

  @Nullable
  public Node owningNode() {
    return owningNode;
  }

  public List<Value> inputs() {
    return param.outputs();
  }

  public List<Value> outputs() {
    return ret.inputs();
  }

  public Node paramNode() {
    return param;
  }

  public Node returnNode() {
    return ret;
  }

  public Value addInput(Type type) {
    return param.addOutput(type);
  }

  public int registerOutput(Value value) {
    ret.addInput(value);
    return ret.inputs().size() - 1;
  }

  @Nullable
  public Node first() {
    return first;
  }

  @Nullable
  public Node last() {
    return last;
  }

  public boolean isEmpty() {
    return first == null;
  }

  /** A snapshot of the node list, in order. */
  public List<Node> nodes() {
    List<Node> ret = new ArrayList<>();
    for (Node cur = first; cur != null; cur = cur.next()) {
      ret.add(cur);
    }
    return ret;
  }

  public Node appendNode(Node node) {
    checkInsertable(node);
    insertBetween(node, last, null);
    return node;
  }

  public Node prependNode(Node node) {
    checkInsertable(node);
    insertBetween(node, null, first);
    return node;
  }

  private void checkInsertable(Node node) {
    Preconditions.checkArgument(
        node.owningGraph() == graph, "%s belongs to another graph", node.kind());
    Preconditions.checkState(!node.isInBlockList(), "%s is already inserted", node);
  }

  void insertBetween(Node node, @Nullable Node prev, @Nullable Node next) {
    node.owningBlock = this;
    node.neighbors[Node.PREV_DIRECTION] = prev;
    node.neighbors[Node.NEXT_DIRECTION] = next;
    if (prev == null) {
      first = node;
    } else {
      prev.neighbors[Node.NEXT_DIRECTION] = node;
    }
    if (next == null) {
      last = node;
    } else {
      next.neighbors[Node.PREV_DIRECTION] = node;
    }
    renumber();
  }

  void unlink(Node node) {
    Node prev = node.prev();
    Node next = node.next();
    if (prev == null) {
      first = next;
    } else {
      prev.neighbors[Node.NEXT_DIRECTION] = next;
    }
    if (next == null) {
      last = prev;
    } else {
      next.neighbors[Node.PREV_DIRECTION] = prev;
    }
    node.neighbors[Node.PREV_DIRECTION] = null;
    node.neighbors[Node.NEXT_DIRECTION] = null;
    node.owningBlock = null;
  }

  private void renumber() {
    long position = 0;
    for (Node cur = first; cur != null; cur = cur.next()) {
      cur.topoPosition = position++;
    }
  }
}
