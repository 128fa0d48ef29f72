package jitalias.ir;

import java.util.List;
import jitalias.ir.types.Type;

/**
 * A computation graph: a root {@link Block} whose inputs and outputs are the graph's. Nodes are
 * created through {@link #create} and then inserted into one of the graph's blocks.
 */
public final class Graph {
  private final Block block;
  private int nextUnique = 0;

  public Graph() {
    this.block = new Block(this, null);
  }

  public Block block() {
    return block;
  }

  public List<Value> inputs() {
    return block.inputs();
  }

  public List<Value> outputs() {
    return block.outputs();
  }

  public Value addInput(Type type) {
    return block.addInput(type);
  }

  public int registerOutput(Value value) {
    return block.registerOutput(value);
  }

  /** Creates a node that isn't inserted into any block yet. */
  public Node create(Symbol kind, List<Value> inputs, List<Type> outputTypes) {
    Node node = new Node(this, kind);
    inputs.forEach(node::addInput);
    outputTypes.forEach(node::addOutput);
    return node;
  }

  public Node create(Symbol kind) {
    return new Node(this, kind);
  }

  /** Appends the node to the root block. */
  public Node appendNode(Node node) {
    return block.appendNode(node);
  }

  int nextUnique() {
    return nextUnique++;
  }

  @Override
  public String toString() {
    return GraphPrinter.print(this);
  }
}
