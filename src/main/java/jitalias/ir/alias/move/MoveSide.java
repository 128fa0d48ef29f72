package jitalias.ir.alias.move;

/** On which side of the move point a node should end up. */
public enum MoveSide {
  BEFORE,
  AFTER;

  public MoveSide reversed() {
    return this == BEFORE ? AFTER : BEFORE;
  }
}
