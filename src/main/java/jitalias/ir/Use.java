package jitalias.ir;

import java.util.Objects;

/** A single use of a {@link Value}: the {@code offset}-th input of {@code user}. */
public final class Use {
  public final Node user;
  public final int offset;

  public Use(Node user, int offset) {
    this.user = user;
    this.offset = offset;
  }

  @Override
  public String toString() {
    return "Use{" + "user=" + user.kind() + ", offset=" + offset + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Use use = (Use) o;
    return offset == use.offset && user == use.user;
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(user), offset);
  }
}
