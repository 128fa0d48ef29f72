package jitalias.ir.alias;

import static org.jooq.lambda.Seq.seq;

import java.util.Map;
import java.util.Set;
import jitalias.ir.Node;
import jitalias.ir.Value;
import jitalias.ir.types.TypeKind;

/** Renders the state of an {@link AliasDb} for debugging. */
class AliasDbPrinter {

  private final AliasDb db;
  private final StringBuilder out = new StringBuilder();

  private AliasDbPrinter(AliasDb db) {
    this.db = db;
  }

  static String print(AliasDb db) {
    AliasDbPrinter printer = new AliasDbPrinter(db);
    printer.printAll();
    return printer.out.toString();
  }

  private void printAll() {
    line("===1. GRAPH===");
    out.append(db.graph());

    line("===2. ALIAS DB===");
    for (Element element : db.memoryDag().elements()) {
      if (!element.pointsTo().isEmpty()) {
        line(name(element) + " points to: " + names(element.pointsTo()));
      }
      if (!element.containedElements().isEmpty()) {
        line(name(element) + " contains: " + names(element.containedElements()));
      }
    }

    line("===3. WRITES===");
    for (Map.Entry<Node, Set<Value>> entry : db.writeIndex().entrySet()) {
      line(writer(entry.getKey()) + " writes to " + seq(entry.getValue()).toString(", "));
    }
    for (Map.Entry<Node, Set<TypeKind>> entry : db.wildcardWriteIndex().entrySet()) {
      line(
          writer(entry.getKey())
              + " writes to "
              + seq(entry.getValue()).map(kind -> "WILDCARD(" + kind + ")").toString(", "));
    }
  }

  private static String writer(Node node) {
    return node.kind().toQualString() + "(" + seq(node.inputs()).toString(", ") + ")";
  }

  private String names(Set<Element> elements) {
    return seq(elements).map(this::name).toString(", ");
  }

  private String name(Element element) {
    if (!element.isWildcard()) {
      return element.name();
    }
    for (Map.Entry<TypeKind, Element> bucket : db.wildcardIndex().entrySet()) {
      if (bucket.getValue() == element) {
        return "WILDCARD(" + bucket.getKey() + ")";
      }
    }
    return element.name();
  }

  private void line(String text) {
    out.append(text).append(System.lineSeparator());
  }
}
