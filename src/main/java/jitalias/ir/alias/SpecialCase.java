package jitalias.ir.alias;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import jitalias.ir.Symbol;
import jitalias.ir.Symbols;

/**
 * Node kinds that are not (reliably) schematized and get a hand-written analyzer in {@link
 * AliasDb}.
 *
 * <p>Every constant needs a matching branch in {@link AliasDb}'s dispatch.
 */
enum SpecialCase {
  IF,
  LOOP,
  SUBGRAPH,
  GRAD_OF,
  CREATOR,
  CONTAINER_CONSTRUCT,
  TUPLE_CONSTRUCT,
  EXTRACTOR,
  CHUNK,
  BROADCASTING_CHUNK,
  SET_ATTR,
  FORK,
  WAIT,
  NO_OP,
  CALL_FUNCTION,
  PROFILE,
  /** Arithmetic, which is a creator only when it comes without a schema. */
  ARITHMETIC;

  private static final ImmutableMap<Symbol, SpecialCase> HANDLED =
      ImmutableMap.<Symbol, SpecialCase>builder()
          .put(Symbols.IF, IF)
          .put(Symbols.LOOP, LOOP)
          .put(Symbols.FUSION_GROUP, SUBGRAPH)
          .put(Symbols.DIFFERENTIABLE_GRAPH, SUBGRAPH)
          .put(Symbols.GRAD_OF, GRAD_OF)
          .put(Symbols.CONSTANT, CREATOR)
          .put(Symbols.AUTOGRAD_ZERO, CREATOR)
          .put(Symbols.AUTOGRAD_ADD, CREATOR)
          .put(Symbols.FUSED_CONCAT, CREATOR)
          .put(Symbols.MM_TREE_REDUCE, CREATOR)
          .put(Symbols.MM_BATCH_SIDE, CREATOR)
          .put(Symbols.BROADCAST_SIZES, CREATOR)
          .put(Symbols.CHUNK_SIZES, CREATOR)
          .put(Symbols.FUNCTION, CREATOR)
          .put(Symbols.CREATE_OBJECT, CREATOR)
          .put(Symbols.DICT_CONSTRUCT, CONTAINER_CONSTRUCT)
          .put(Symbols.LIST_CONSTRUCT, CONTAINER_CONSTRUCT)
          .put(Symbols.TUPLE_CONSTRUCT, TUPLE_CONSTRUCT)
          .put(Symbols.TUPLE_UNPACK, EXTRACTOR)
          .put(Symbols.TUPLE_INDEX, EXTRACTOR)
          .put(Symbols.TUPLE_SLICE, EXTRACTOR)
          .put(Symbols.DICT_INDEX, EXTRACTOR)
          .put(Symbols.LIST_UNPACK, EXTRACTOR)
          .put(Symbols.PYTHON_OP, EXTRACTOR)
          .put(Symbols.GET_ATTR, EXTRACTOR)
          .put(Symbols.CONSTANT_CHUNK, CHUNK)
          .put(Symbols.BROADCASTING_CHUNK, BROADCASTING_CHUNK)
          .put(Symbols.SET_ATTR, SET_ATTR)
          .put(Symbols.FORK, FORK)
          .put(Symbols.WAIT, WAIT)
          .put(Symbols.PRINT, NO_OP)
          .put(Symbols.CALL_FUNCTION, CALL_FUNCTION)
          .put(Symbols.PROFILE, PROFILE)
          .put(Symbols.ADD, ARITHMETIC)
          .put(Symbols.SUB, ARITHMETIC)
          .put(Symbols.MUL, ARITHMETIC)
          .put(Symbols.DIV, ARITHMETIC)
          .build();

  /** Kinds that should never reach the alias analysis. */
  private static final ImmutableSet<Symbol> PURPOSEFULLY_NOT_HANDLED =
      ImmutableSet.of(
          Symbols.LOAD,
          Symbols.STORE,
          Symbols.DROP,
          Symbols.ONNX_RESHAPE,
          Symbols.ONNX_SHAPE,
          Symbols.AUTOGRAD_ANY_NON_ZERO);

  static Optional<SpecialCase> forKind(Symbol kind) {
    return Optional.ofNullable(HANDLED.get(kind));
  }

  /** Is {@code kind} part of the closed set of kinds the analysis knows about without a schema? */
  static boolean hasSpecialCaseFor(Symbol kind) {
    return HANDLED.containsKey(kind) || PURPOSEFULLY_NOT_HANDLED.contains(kind);
  }
}
