package jitalias.ir;

import static java.util.Arrays.asList;

import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.generator.Size;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import java.util.ArrayList;
import java.util.List;
import jitalias.ir.schema.Schemas;
import jitalias.ir.types.Type;

/**
 * Generates well-formed graphs over tensors, tensor lists and ints, mixing pure operators, in-place
 * writes, views, containers, fork/wait, joins of optionals with None and nested {@code If}s.
 */
public class GraphGenerator extends Generator<Graph> {

  private static final int MAX_DEPTH = 2;

  private int sizeHint = 20;
  private GraphBuilder b;
  private SourceOfRandomness random;
  private final List<Value> tensors = new ArrayList<>();
  private final List<Value> lists = new ArrayList<>();
  private final List<Value> ints = new ArrayList<>();

  public GraphGenerator() {
    super(Graph.class);
  }

  public void configure(Size size) {
    sizeHint = size.max();
  }

  @Override
  public Graph generate(SourceOfRandomness random, GenerationStatus status) {
    this.random = random;
    b = new GraphBuilder();
    tensors.clear();
    lists.clear();
    ints.clear();

    Value sizes = b.input(Type.listOf(Type.INT));
    Value cond = b.input(Type.BOOL);
    int inputs = random.nextInt(1, 3);
    for (int i = 0; i < inputs; ++i) {
      tensors.add(b.tensorInput());
    }
    if (random.nextBoolean()) {
      lists.add(b.input(Type.listOf(Type.TENSOR)));
    }
    int nodes = random.nextInt(1, Math.max(1, sizeHint));
    for (int i = 0; i < nodes; ++i) {
      genNode(sizes, cond, 0);
    }
    return b.graph;
  }

  private void genNode(Value sizes, Value cond, int depth) {
    switch (random.nextInt(0, 14)) {
      case 0:
        tensors.add(b.freshTensor());
        break;
      case 1:
        tensors.add(b.call(Schemas.NEG, anyTensor()).output());
        break;
      case 2:
        tensors.add(b.call(Schemas.ADD, anyTensor(), anyTensor()).output());
        break;
      case 3:
        tensors.add(b.call(Schemas.ADD_, anyTensor(), anyTensor()).output());
        break;
      case 4:
        tensors.add(b.call(Schemas.RELU_, anyTensor()).output());
        break;
      case 5:
        tensors.add(b.call(Schemas.VIEW, anyTensor(), sizes).output());
        break;
      case 6:
        tensors.add(b.call(Schemas.CLONE, anyTensor()).output());
        break;
      case 7:
        tensors.add(b.call(Schemas.CUDA, anyTensor()).output());
        break;
      case 8:
        lists.add(
            b.append(
                    Symbols.LIST_CONSTRUCT,
                    asList(anyTensor(), anyTensor()),
                    Type.listOf(Type.TENSOR))
                .output());
        break;
      case 9:
        if (lists.isEmpty()) {
          ints.add(b.call(Schemas.SIZE, anyTensor()).output());
        } else {
          lists.add(b.call(Schemas.APPEND, random.choose(lists), anyTensor()).output());
        }
        break;
      case 10:
        if (lists.isEmpty() || ints.isEmpty()) {
          ints.add(b.call(Schemas.SIZE, anyTensor()).output());
        } else {
          tensors.add(b.call(Schemas.SELECT, random.choose(lists), random.choose(ints)).output());
        }
        break;
      case 11:
        {
          Node fork = b.append(Symbols.FORK, asList(anyTensor()), Type.futureOf(Type.TENSOR));
          tensors.add(b.append(Symbols.WAIT, asList(fork.output()), Type.TENSOR).output());
          break;
        }
      case 12:
        genOptionalJoin(cond);
        break;
      default:
        if (depth >= MAX_DEPTH) {
          tensors.add(b.call(Schemas.MUL, anyTensor(), anyTensor()).output());
        } else {
          Node ifNode =
              b.ifThenElse(
                  cond, () -> genBranch(sizes, cond, depth), () -> genBranch(sizes, cond, depth));
          tensors.add(ifNode.output());
        }
        break;
    }
  }

  /** An {@code Optional[Tensor]} joining None with a tensor or with another None. */
  private void genOptionalJoin(Value cond) {
    Value none = b.constant(Type.NONE);
    Value other = random.nextBoolean() ? anyTensor() : b.constant(Type.NONE);
    Node ifNode = b.ifThenElse(cond, () -> none, () -> other);
    ifNode.output().setType(Type.optionalOf(Type.TENSOR));
    if (random.nextBoolean()) {
      b.append(Symbol.of("custom", "consume"), asList(ifNode.output()));
    }
  }

  /** Appends a few nodes and picks the branch result. Nothing defined in the branch escapes it. */
  private Value genBranch(Value sizes, Value cond, int depth) {
    int tensorsBefore = tensors.size();
    int listsBefore = lists.size();
    int intsBefore = ints.size();
    int n = random.nextInt(0, 3);
    for (int i = 0; i < n; ++i) {
      genNode(sizes, cond, depth + 1);
    }
    Value result = anyTensor();
    truncate(tensors, tensorsBefore);
    truncate(lists, listsBefore);
    truncate(ints, intsBefore);
    return result;
  }

  private Value anyTensor() {
    return random.choose(tensors);
  }

  private static void truncate(List<Value> values, int size) {
    values.subList(size, values.size()).clear();
  }

  /** All values defined in {@code graph}, including those of nested blocks. */
  public static List<Value> allValues(Graph graph) {
    List<Value> values = new ArrayList<>(graph.inputs());
    for (Node node : allNodes(graph)) {
      values.addAll(node.outputs());
    }
    return values;
  }

  /** All nodes of {@code graph} in pre-order, including those of nested blocks. */
  public static List<Node> allNodes(Graph graph) {
    List<Node> nodes = new ArrayList<>();
    collectNodes(graph.block(), nodes);
    return nodes;
  }

  private static void collectNodes(Block block, List<Node> nodes) {
    for (Node node : block.nodes()) {
      nodes.add(node);
      for (Block nested : node.blocks()) {
        collectNodes(nested, nodes);
      }
    }
  }
}
