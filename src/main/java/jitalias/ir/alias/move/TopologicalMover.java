package jitalias.ir.alias.move;

import com.google.common.base.Preconditions;
import java.util.Optional;
import jitalias.EnvVar;
import jitalias.ir.Block;
import jitalias.ir.Node;
import jitalias.ir.alias.AliasDb;
import jitalias.ir.utils.NodeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reorders nodes within a block while keeping the program's meaning, as far as the {@link AliasDb}
 * can tell.
 *
 * <p>Moving {@code n} next to a move point {@code p} drags along every node between them that
 * {@code n} depends on (or that depends on {@code n}), through data or through aliasing writes. The
 * move fails if {@code p} itself is such a node. Moves only change the order of nodes, so the
 * {@link AliasDb} stays valid.
 */
public class TopologicalMover {

  private static final Logger LOGGER = LoggerFactory.getLogger("TopologicalMover");

  private final AliasDb aliasDb;

  public TopologicalMover(AliasDb aliasDb) {
    this.aliasDb = aliasDb;
  }

  /** Moves {@code n} right after {@code movePoint}, if possible. */
  public boolean moveAfterTopologicallyValid(Node n, Node movePoint) {
    return tryMove(n, movePoint, MoveSide.AFTER, false);
  }

  /** Moves {@code n} right before {@code movePoint}, if possible. */
  public boolean moveBeforeTopologicallyValid(Node n, Node movePoint) {
    return tryMove(n, movePoint, MoveSide.BEFORE, false);
  }

  public boolean couldMoveAfterTopologically(Node n, Node movePoint) {
    return tryMove(n, movePoint, MoveSide.AFTER, true);
  }

  public boolean couldMoveBeforeTopologically(Node n, Node movePoint) {
    return tryMove(n, movePoint, MoveSide.BEFORE, true);
  }

  /**
   * Tries to place {@code toMove} on {@code moveSide} of {@code movePoint}.
   *
   * @param dryRun only decide, but don't touch the graph
   * @return whether the move is (or would have been) carried out
   */
  public boolean tryMove(Node toMove, Node movePoint, MoveSide moveSide, boolean dryRun) {
    Preconditions.checkArgument(
        toMove.owningBlock() == movePoint.owningBlock(),
        "%s and %s are not in the same block",
        toMove,
        movePoint);
    if (toMove == movePoint) {
      return true;
    }

    // Collect everything between toMove and movePoint that has to come along.
    WorkingSet workingSet = new WorkingSet(toMove, aliasDb);
    int direction = toMove.isAfter(movePoint) ? Node.PREV_DIRECTION : Node.NEXT_DIRECTION;
    for (Node cur = toMove.neighbor(direction); cur != movePoint; cur = cur.neighbor(direction)) {
      if (workingSet.dependsOn(cur)) {
        workingSet.add(cur);
      }
    }

    // If toMove ends up on the near side of movePoint, its dependencies go to the far side.
    boolean split =
        (moveSide == MoveSide.BEFORE && toMove.isBefore(movePoint))
            || (moveSide == MoveSide.AFTER && toMove.isAfter(movePoint));
    if (split) {
      workingSet.eraseMover();
    }

    if (workingSet.dependsOn(movePoint)) {
      LOGGER.debug(
          "Can't move {} {} {}: {} depends on the move point",
          toMove.kind(),
          moveSide,
          movePoint.kind(),
          workingSet);
      return false;
    }
    if (dryRun) {
      return true;
    }

    if (split) {
      move(toMove, movePoint, moveSide);
      Node cur = movePoint;
      for (Node n : workingSet.nodes()) {
        move(n, cur, moveSide.reversed());
        cur = n;
      }
    } else {
      Node cur = movePoint;
      for (Node n : workingSet.nodes()) {
        move(n, cur, moveSide);
        cur = n;
      }
    }
    if (EnvVar.JITALIAS_CHECK_MOVES.isSetToOne()) {
      checkTopologicallyValid(movePoint.owningBlock());
    }
    return true;
  }

  private static void move(Node toMove, Node movePoint, MoveSide moveSide) {
    switch (moveSide) {
      case BEFORE:
        toMove.moveBefore(movePoint);
        break;
      case AFTER:
        toMove.moveAfter(movePoint);
        break;
      default:
        throw new AssertionError("Unhandled move side " + moveSide);
    }
  }

  private static void checkTopologicallyValid(Block block) {
    Optional<Node> offending = NodeUtils.findUseBeforeDef(block);
    Preconditions.checkState(
        !offending.isPresent(), "Move broke the topological order at %s", offending.orElse(null));
  }
}
