package jitalias.ir;

import static org.jooq.lambda.Seq.seq;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import jitalias.ir.schema.FunctionSchema;
import jitalias.ir.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * An operation of the IR. A node consumes ordered input values, produces ordered output values and
 * may own nested blocks (control flow). It lives in exactly one block's node list once inserted.
 */
public final class Node {

  public static final int PREV_DIRECTION = 0;
  public static final int NEXT_DIRECTION = 1;

  private final Graph graph;
  private final Symbol kind;
  private final List<Value> inputs = new ArrayList<>();
  private final List<Value> outputs = new ArrayList<>();
  private final List<Block> blocks = new ArrayList<>();
  private final Map<Symbol, Object> attributes = new LinkedHashMap<>();
  @Nullable private FunctionSchema schema;

  @Nullable Block owningBlock;
  /** Indexed by {@link #PREV_DIRECTION} and {@link #NEXT_DIRECTION}. */
  final Node[] neighbors = new Node[2];
  /** Position inside the owning block's node list, maintained by {@link Block}. */
  long topoPosition;

  Node(Graph graph, Symbol kind) {
    this.graph = graph;
    this.kind = kind;
  }

  public Symbol kind() {
    return kind;
  }

  public Graph owningGraph() {
    return graph;
  }

  @Nullable
  public Block owningBlock() {
    return owningBlock;
  }

  public boolean isInBlockList() {
    return owningBlock != null && !isBoundary();
  }

  private boolean isBoundary() {
    return kind.equals(Symbols.PARAM) || kind.equals(Symbols.RETURN);
  }

  public List<Value> inputs() {
    return Collections.unmodifiableList(inputs);
  }

  public List<Value> outputs() {
    return Collections.unmodifiableList(outputs);
  }

  public Value input() {
    Preconditions.checkState(inputs.size() == 1, "%s has %s inputs", kind, inputs.size());
    return inputs.get(0);
  }

  public Value output() {
    Preconditions.checkState(outputs.size() == 1, "%s has %s outputs", kind, outputs.size());
    return outputs.get(0);
  }

  public Value input(int i) {
    return inputs.get(i);
  }

  public Value output(int i) {
    return outputs.get(i);
  }

  public Value addInput(Value value) {
    Preconditions.checkArgument(
        value.owningGraph() == graph, "%s belongs to another graph than %s", value, kind);
    value.uses.add(new Use(this, inputs.size()));
    inputs.add(value);
    return value;
  }

  public Value addOutput(Type type) {
    Value value = new Value(this, outputs.size(), type, graph.nextUnique());
    outputs.add(value);
    return value;
  }

  public List<Block> blocks() {
    return Collections.unmodifiableList(blocks);
  }

  public Block addBlock() {
    Block block = new Block(graph, this);
    blocks.add(block);
    return block;
  }

  public Optional<FunctionSchema> maybeSchema() {
    return Optional.ofNullable(schema);
  }

  public FunctionSchema schema() {
    Preconditions.checkState(schema != null, "%s has no schema", kind);
    return schema;
  }

  public Node setSchema(FunctionSchema schema) {
    Preconditions.checkArgument(
        schema.name.equals(kind), "schema %s doesn't describe %s", schema.name, kind);
    this.schema = schema;
    return this;
  }

  public boolean hasAttribute(Symbol name) {
    return attributes.containsKey(name);
  }

  public long i(Symbol name) {
    return getAttribute(name, Long.class);
  }

  public Node setI(Symbol name, long value) {
    return setAttribute(name, value);
  }

  public Graph g(Symbol name) {
    return getAttribute(name, Graph.class);
  }

  public Node setG(Symbol name, Graph subgraph) {
    return setAttribute(name, subgraph);
  }

  private Node setAttribute(Symbol name, Object value) {
    Preconditions.checkArgument(name.isAttribute(), "%s is not an attribute name", name);
    attributes.put(name, value);
    return this;
  }

  private <T> T getAttribute(Symbol name, Class<T> expected) {
    Object value = attributes.get(name);
    Preconditions.checkArgument(value != null, "%s has no attribute %s", kind, name);
    Preconditions.checkArgument(
        expected.isInstance(value), "attribute %s of %s is not a %s", name, kind, expected);
    return expected.cast(value);
  }

  Map<Symbol, Object> attributes() {
    return attributes;
  }

  @Nullable
  public Node next() {
    return neighbors[NEXT_DIRECTION];
  }

  @Nullable
  public Node prev() {
    return neighbors[PREV_DIRECTION];
  }

  /** The neighbor in the owning block, see {@link #PREV_DIRECTION} and {@link #NEXT_DIRECTION}. */
  @Nullable
  public Node neighbor(int direction) {
    Preconditions.checkArgument(
        direction == PREV_DIRECTION || direction == NEXT_DIRECTION, "bad direction %s", direction);
    return neighbors[direction];
  }

  public boolean isBefore(Node n) {
    return isBeforeOrAfter(n, true);
  }

  public boolean isAfter(Node n) {
    return isBeforeOrAfter(n, false);
  }

  /**
   * Compares positions in the topological order. Nodes in different blocks are compared through
   * their owning nodes in the innermost common block.
   */
  private boolean isBeforeOrAfter(Node n, boolean before) {
    Preconditions.checkArgument(
        graph == n.graph, "can't compare %s and %s of different graphs", this, n);
    Preconditions.checkState(isInBlockList() && n.isInBlockList(), "nodes must be inserted");
    if (owningBlock == n.owningBlock) {
      return before ? topoPosition < n.topoPosition : topoPosition > n.topoPosition;
    }
    for (Node lhs = this; lhs != null; lhs = lhs.owningBlock.owningNode()) {
      for (Node rhs = n; rhs != null; rhs = rhs.owningBlock.owningNode()) {
        if (lhs.owningBlock == rhs.owningBlock) {
          Preconditions.checkArgument(
              lhs != rhs, "%s and %s are nested in one another", this.kind, n.kind);
          return lhs.isBeforeOrAfter(rhs, before);
        }
      }
    }
    throw new AssertionError("No common block of " + this + " and " + n);
  }

  /** Unlinks this node from its current position and inserts it right before {@code n}. */
  public void moveBefore(Node n) {
    Preconditions.checkArgument(n != this, "can't move %s before itself", this);
    removeFromList();
    insertBefore(n);
  }

  /** Unlinks this node from its current position and inserts it right after {@code n}. */
  public void moveAfter(Node n) {
    Preconditions.checkArgument(n != this, "can't move %s after itself", this);
    removeFromList();
    insertAfter(n);
  }

  public Node insertBefore(Node n) {
    Preconditions.checkState(!isInBlockList(), "%s is already inserted", this);
    Preconditions.checkArgument(n.isInBlockList(), "%s isn't inserted", n);
    n.owningBlock.insertBetween(this, n.prev(), n);
    return this;
  }

  public Node insertAfter(Node n) {
    Preconditions.checkState(!isInBlockList(), "%s is already inserted", this);
    Preconditions.checkArgument(n.isInBlockList(), "%s isn't inserted", n);
    n.owningBlock.insertBetween(this, n, n.next());
    return this;
  }

  private void removeFromList() {
    Preconditions.checkState(isInBlockList(), "%s isn't inserted", this);
    owningBlock.unlink(this);
  }

  /** Prints the node in the form {@code %3 : Tensor = aten::add_(%1, %2)}, without sub-blocks. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (!outputs.isEmpty()) {
      sb.append(seq(outputs).map(o -> o + " : " + o.type()).toString(", ")).append(" = ");
    }
    sb.append(kind.toQualString());
    if (!attributes.isEmpty()) {
      sb.append("[")
          .append(
              seq(attributes.entrySet())
                  .map(e -> e.getKey().name + "=" + printAttribute(e.getValue()))
                  .toString(", "))
          .append("]");
    }
    sb.append("(").append(seq(inputs).toString(", ")).append(")");
    return sb.toString();
  }

  private static String printAttribute(Object value) {
    return value instanceof Graph ? "<Graph>" : String.valueOf(value);
  }
}
