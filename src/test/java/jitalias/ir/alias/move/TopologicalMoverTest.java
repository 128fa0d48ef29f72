package jitalias.ir.alias.move;

import static java.util.Arrays.asList;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

import java.util.List;
import jitalias.ir.GraphBuilder;
import jitalias.ir.Node;
import jitalias.ir.Symbols;
import jitalias.ir.Value;
import jitalias.ir.alias.AliasDb;
import jitalias.ir.schema.Schemas;
import jitalias.ir.types.Type;
import org.junit.Before;
import org.junit.Test;

public class TopologicalMoverTest {

  private GraphBuilder b;

  @Before
  public void setUp() {
    b = new GraphBuilder();
  }

  private TopologicalMover mover() {
    return new TopologicalMover(new AliasDb(b.graph));
  }

  private List<Node> order() {
    return b.graph.block().nodes();
  }

  @Test
  public void readsCannotMovePastAnInterleavedWrite() throws Exception {
    Value z = b.freshTensor();
    Value x = b.tensorInput();
    Value y = b.tensorInput();
    Node a = b.call(Schemas.NEG, x);
    b.call(Schemas.ADD_, x, y);
    Node c = b.call(Schemas.NEG, x);
    Node d = b.call(Schemas.RELU_, z);
    TopologicalMover mover = mover();

    assertThat(mover.couldMoveAfterTopologically(a, c), is(false));
    assertThat(mover.couldMoveBeforeTopologically(c, a), is(false));
    assertThat(mover.moveBeforeTopologicallyValid(d, a), is(true));
    assertThat(order().get(1), is(d));
    assertThat(order().get(2), is(a));
  }

  @Test
  public void failedMove_leavesTheGraphUntouched() throws Exception {
    Value x = b.tensorInput();
    Node a = b.call(Schemas.NEG, x);
    Node write = b.call(Schemas.ADD_, x, x);
    Node c = b.call(Schemas.NEG, x);
    TopologicalMover mover = mover();

    assertThat(mover.moveAfterTopologicallyValid(a, c), is(false));
    assertThat(order(), contains(a, write, c));
  }

  @Test
  public void moveAfter_dragsUsersAlong() throws Exception {
    Value x = b.freshTensor();
    Node constant = x.node();
    Node p = b.call(Schemas.NEG, x);
    Node q = b.call(Schemas.NEG, p.output());
    Node r = b.call(Schemas.MUL, x, x);

    assertThat(mover().moveAfterTopologicallyValid(p, r), is(true));
    assertThat(order(), contains(constant, r, p, q));
  }

  @Test
  public void moveBefore_dragsDependenciesToTheOtherSide() throws Exception {
    Value x = b.freshTensor();
    Node constant = x.node();
    Node p = b.call(Schemas.NEG, x);
    Node q = b.call(Schemas.NEG, p.output());
    Node r = b.call(Schemas.MUL, x, x);

    assertThat(mover().moveBeforeTopologicallyValid(p, r), is(true));
    assertThat(order(), contains(constant, p, r, q));
  }

  @Test
  public void moveBefore_dragsProducersAlong() throws Exception {
    Value x = b.freshTensor();
    Node constant = x.node();
    Node r = b.call(Schemas.MUL, x, x);
    Node p = b.call(Schemas.NEG, x);
    Node q = b.call(Schemas.NEG, p.output());

    assertThat(mover().moveBeforeTopologicallyValid(q, r), is(true));
    assertThat(order(), contains(constant, p, q, r));
  }

  @Test
  public void cannotMoveAUserBeforeItsProducer() throws Exception {
    Value x = b.freshTensor();
    Node p = b.call(Schemas.NEG, x);
    Node q = b.call(Schemas.NEG, p.output());

    assertThat(mover().couldMoveBeforeTopologically(q, p), is(false));
    assertThat(mover().couldMoveAfterTopologically(p, q), is(false));
  }

  @Test
  public void movingNextToItself_succeeds() throws Exception {
    Node n = b.call(Schemas.NEG, b.tensorInput());
    TopologicalMover mover = mover();

    assertThat(mover.moveAfterTopologicallyValid(n, n), is(true));
    assertThat(mover.couldMoveBeforeTopologically(n, n), is(true));
  }

  @Test(expected = IllegalArgumentException.class)
  public void movingAcrossBlocks_throws() throws Exception {
    Value cond = b.input(Type.BOOL);
    Value x = b.freshTensor();
    Node[] nested = new Node[1];
    b.ifThenElse(
        cond,
        () -> {
          nested[0] = b.call(Schemas.NEG, x);
          return nested[0].output();
        },
        () -> x);

    mover().couldMoveBeforeTopologically(nested[0], x.node());
  }

  @Test
  public void dryRun_doesNotChangeTheOrder() throws Exception {
    Value x = b.freshTensor();
    Node constant = x.node();
    Node p = b.call(Schemas.NEG, x);
    Node q = b.call(Schemas.NEG, p.output());
    Node r = b.call(Schemas.MUL, x, x);
    TopologicalMover mover = mover();

    assertThat(mover.couldMoveAfterTopologically(p, r), is(true));
    assertThat(mover.couldMoveBeforeTopologically(p, r), is(true));
    assertThat(mover.tryMove(r, constant, MoveSide.AFTER, true), is(true));
    assertThat(order(), contains(constant, p, q, r));
  }

  @Test
  public void wait_blocksReadersOfWildcardValues() throws Exception {
    Value x = b.tensorInput();
    Value z = b.freshTensor();
    Node fork = b.append(Symbols.FORK, asList(x), Type.futureOf(Type.TENSOR));
    Node wait = b.append(Symbols.WAIT, asList(fork.output()), Type.TENSOR);
    Node readsInput = b.call(Schemas.NEG, x);
    Node readsFresh = b.call(Schemas.NEG, z);
    TopologicalMover mover = mover();

    assertThat(mover.couldMoveBeforeTopologically(readsInput, wait), is(false));
    assertThat(mover.couldMoveBeforeTopologically(readsFresh, wait), is(true));
  }

  @Test
  public void writesInNestedBlocks_countForTheOwner() throws Exception {
    Value cond = b.input(Type.BOOL);
    Value x = b.freshTensor();
    Value y = b.freshTensor();
    Value z = b.freshTensor();
    Node readsX = b.call(Schemas.NEG, x);
    Node readsZ = b.call(Schemas.NEG, z);
    Node ifNode = b.ifThenElse(cond, () -> b.call(Schemas.ADD_, x, y).output(), () -> x);
    TopologicalMover mover = mover();

    assertThat(mover.couldMoveAfterTopologically(readsX, ifNode), is(false));
    assertThat(mover.moveAfterTopologicallyValid(readsZ, ifNode), is(true));
    assertThat(ifNode.next(), is(readsZ));
  }
}
