package jitalias;

/** Root of the errors reported by this library for malformed input graphs. */
public class JitAliasError extends RuntimeException {

  public JitAliasError(Exception wrapped) {
    super(wrapped);
  }

  public JitAliasError(String message) {
    super(message);
  }
}
