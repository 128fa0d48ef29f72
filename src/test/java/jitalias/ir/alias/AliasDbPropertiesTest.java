package jitalias.ir.alias;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.generator.Size;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;
import java.util.List;
import java.util.Optional;
import jitalias.ir.Graph;
import jitalias.ir.GraphGenerator;
import jitalias.ir.Node;
import jitalias.ir.Value;
import jitalias.ir.types.TypeKind;
import org.junit.runner.RunWith;

@RunWith(JUnitQuickcheck.class)
public class AliasDbPropertiesTest {

  @Property(trials = 200)
  public void mutableValuesAliasThemselves(
      @From(GraphGenerator.class) @Size(max = 30) Graph graph) {
    AliasDb db = new AliasDb(graph);
    for (Value v : GraphGenerator.allValues(graph)) {
      if (MutableTypes.shouldAnnotate(v)) {
        assertTrue(v + " should alias itself", db.mayAlias(v, v));
      }
    }
  }

  @Property(trials = 200)
  public void aliasQueriesAreSymmetric(@From(GraphGenerator.class) @Size(max = 30) Graph graph) {
    AliasDb db = new AliasDb(graph);
    List<Value> values = GraphGenerator.allValues(graph);
    for (Value a : values) {
      for (Value b : values) {
        assertEquals(a + ", " + b, db.mayAlias(a, b), db.mayAlias(b, a));
        assertEquals(a + ", " + b, db.mayContainAlias(a, b), db.mayContainAlias(b, a));
      }
    }
  }

  @Property(trials = 200)
  public void immutableValuesNeverAlias(@From(GraphGenerator.class) @Size(max = 30) Graph graph) {
    AliasDb db = new AliasDb(graph);
    List<Value> values = GraphGenerator.allValues(graph);
    for (Value a : values) {
      if (MutableTypes.shouldAnnotate(a)) {
        continue;
      }
      assertFalse(db.hasWriters(a));
      for (Value b : values) {
        assertFalse(a + ", " + b, db.mayAlias(a, b));
      }
    }
  }

  @Property(trials = 200)
  public void wildcardValuesOfTheSameKindAlias(
      @From(GraphGenerator.class) @Size(max = 30) Graph graph) {
    AliasDb db = new AliasDb(graph);
    List<Value> values = GraphGenerator.allValues(graph);
    for (Value a : values) {
      for (Value b : values) {
        Optional<TypeKind> kind = MutableTypes.mutableKind(a.type());
        if (db.mayAliasWildcard(a)
            && db.mayAliasWildcard(b)
            && kind.equals(MutableTypes.mutableKind(b.type()))) {
          assertTrue(a + ", " + b, db.mayAlias(a, b));
        }
      }
    }
  }

  @Property(trials = 200)
  public void writtenValuesHaveWriters(@From(GraphGenerator.class) @Size(max = 30) Graph graph) {
    AliasDb db = new AliasDb(graph);
    for (Node node : GraphGenerator.allNodes(graph)) {
      for (Value written : db.getWrites(node, false)) {
        assertTrue(written + " written by " + node, db.hasWriters(written));
      }
      if (!db.getWrites(node, false).isEmpty() || !db.getWildcardWrites(node, false).isEmpty()) {
        assertTrue(db.hasWrites(node));
      }
    }
  }

  @Property(trials = 100)
  public void analysisIsDeterministic(@From(GraphGenerator.class) @Size(max = 30) Graph graph) {
    AliasDb first = new AliasDb(graph);
    AliasDb second = new AliasDb(graph);
    List<Value> values = GraphGenerator.allValues(graph);
    for (Value a : values) {
      assertEquals(first.hasWriters(a), second.hasWriters(a));
      for (Value b : values) {
        assertEquals(first.mayAlias(a, b), second.mayAlias(a, b));
      }
    }
    for (Node node : GraphGenerator.allNodes(graph)) {
      assertEquals(first.getWrites(node, true), second.getWrites(node, true));
      assertEquals(first.getWildcardWrites(node, true), second.getWildcardWrites(node, true));
    }
  }
}
