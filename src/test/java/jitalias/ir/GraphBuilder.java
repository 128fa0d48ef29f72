package jitalias.ir;

import static org.jooq.lambda.Seq.seq;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.function.Supplier;
import jitalias.ir.schema.FunctionSchema;
import jitalias.ir.types.Type;

/** Appends nodes to a graph, descending into nested blocks on demand. */
public class GraphBuilder {

  public final Graph graph = new Graph();
  private final Deque<Block> insertionPoints = new ArrayDeque<>();

  public GraphBuilder() {
    insertionPoints.push(graph.block());
  }

  public Value input(Type type) {
    return graph.addInput(type);
  }

  public Value tensorInput() {
    return input(Type.TENSOR);
  }

  public Node append(Symbol kind, Value... inputs) {
    return append(kind, Arrays.asList(inputs));
  }

  public Node append(Symbol kind, Iterable<Value> inputs, Type... outputTypes) {
    Node node = graph.create(kind, seq(inputs).toList(), Arrays.asList(outputTypes));
    return insertionPoints.peek().appendNode(node);
  }

  /** Appends a node with outputs as declared by the schema. */
  public Node call(FunctionSchema schema, Value... inputs) {
    Node node =
        graph.create(
            schema.name, Arrays.asList(inputs), seq(schema.returns()).map(r -> r.type).toList());
    node.setSchema(schema);
    return insertionPoints.peek().appendNode(node);
  }

  /** A fresh value, produced by a constant. */
  public Value constant(Type type) {
    Node node = graph.create(Symbols.CONSTANT, Collections.emptyList(), Arrays.asList(type));
    node.setI(Symbols.ATTR_VALUE, 0);
    return insertionPoints.peek().appendNode(node).output();
  }

  public Value freshTensor() {
    return constant(Type.TENSOR);
  }

  /** Runs {@code body} with {@code block} as insertion point. */
  public <T> T inBlock(Block block, Supplier<T> body) {
    insertionPoints.push(block);
    try {
      return body.get();
    } finally {
      insertionPoints.pop();
    }
  }

  /** {@code If(cond)} with the given branch results as outputs. */
  public Node ifThenElse(Value cond, Supplier<Value> thenBranch, Supplier<Value> elseBranch) {
    Node node = append(Symbols.IF, Collections.singletonList(cond));
    Block trueBlock = node.addBlock();
    Block falseBlock = node.addBlock();
    Value thenResult = inBlock(trueBlock, thenBranch);
    Value elseResult = inBlock(falseBlock, elseBranch);
    trueBlock.registerOutput(thenResult);
    falseBlock.registerOutput(elseResult);
    node.addOutput(thenResult.type());
    return node;
  }
}
