package jitalias.ir.alias;

import jitalias.JitAliasError;
import jitalias.ir.Node;

/**
 * Thrown when the alias analysis meets a node it has no alias information for. This is a bug in
 * whoever produced the graph: the operator needs a schema or a dedicated analyzer.
 */
public class AliasAnalysisError extends JitAliasError {

  public AliasAnalysisError(String message, Node node) {
    super(message + System.lineSeparator() + "Node: " + node);
  }
}
