package jitalias.ir;

import static org.jooq.lambda.Seq.seq;

import com.google.common.base.Strings;
import java.util.Map;

/** Prints graphs in the textual IR format, one node per line with nested blocks indented. */
public class GraphPrinter {
  private static final int INDENT = 2;

  private final StringBuilder out = new StringBuilder();

  private GraphPrinter() {}

  public static String print(Graph graph) {
    GraphPrinter printer = new GraphPrinter();
    printer.printGraph(graph, 0);
    return printer.out.toString();
  }

  private void printGraph(Graph graph, int indent) {
    line(indent, "graph(" + typedList(graph.block().inputs()) + "):");
    printNodes(graph.block(), indent + INDENT);
    line(indent + INDENT, "return (" + seq(graph.outputs()).toString(", ") + ")");
  }

  private void printNodes(Block block, int indent) {
    for (Node node : block.nodes()) {
      line(indent, node.toString());
      for (int i = 0; i < node.blocks().size(); ++i) {
        Block nested = node.blocks().get(i);
        line(indent + INDENT, "block" + i + "(" + typedList(nested.inputs()) + "):");
        printNodes(nested, indent + 2 * INDENT);
        line(indent + 2 * INDENT, "-> (" + seq(nested.outputs()).toString(", ") + ")");
      }
      for (Map.Entry<Symbol, Object> attr : node.attributes().entrySet()) {
        if (attr.getValue() instanceof Graph) {
          line(indent + INDENT, "with " + attr.getKey().name + " =");
          printGraph((Graph) attr.getValue(), indent + 2 * INDENT);
        }
      }
    }
  }

  private static String typedList(Iterable<Value> values) {
    return seq(values).map(v -> v + " : " + v.type()).toString(", ");
  }

  private void line(int indent, String text) {
    out.append(Strings.repeat(" ", indent)).append(text).append(System.lineSeparator());
  }
}
