package jitalias.ir;

/** The well-known node kinds and attribute names of the IR. */
public final class Symbols {

  private Symbols() {}

  // Control flow and subgraphs
  public static final Symbol IF = Symbol.prim("If");
  public static final Symbol LOOP = Symbol.prim("Loop");
  public static final Symbol FUSION_GROUP = Symbol.prim("FusionGroup");
  public static final Symbol DIFFERENTIABLE_GRAPH = Symbol.prim("DifferentiableGraph");
  public static final Symbol GRAD_OF = Symbol.prim("GradOf");

  // Block boundaries, never part of a block's node list
  public static final Symbol PARAM = Symbol.prim("Param");
  public static final Symbol RETURN = Symbol.prim("Return");

  // Creators
  public static final Symbol CONSTANT = Symbol.prim("Constant");
  public static final Symbol AUTOGRAD_ZERO = Symbol.prim("AutogradZero");
  public static final Symbol AUTOGRAD_ADD = Symbol.prim("AutogradAdd");
  public static final Symbol AUTOGRAD_ANY_NON_ZERO = Symbol.prim("AutogradAnyNonZero");
  public static final Symbol FUSED_CONCAT = Symbol.prim("FusedConcat");
  public static final Symbol MM_TREE_REDUCE = Symbol.prim("MMTreeReduce");
  public static final Symbol MM_BATCH_SIDE = Symbol.prim("MMBatchSide");
  public static final Symbol BROADCAST_SIZES = Symbol.prim("BroadcastSizes");
  public static final Symbol CHUNK_SIZES = Symbol.prim("ChunkSizes");
  public static final Symbol FUNCTION = Symbol.prim("Function");
  public static final Symbol CREATE_OBJECT = Symbol.prim("CreateObject");

  // Containers
  public static final Symbol DICT_CONSTRUCT = Symbol.prim("DictConstruct");
  public static final Symbol LIST_CONSTRUCT = Symbol.prim("ListConstruct");
  public static final Symbol TUPLE_CONSTRUCT = Symbol.prim("TupleConstruct");
  public static final Symbol TUPLE_UNPACK = Symbol.prim("TupleUnpack");
  public static final Symbol TUPLE_INDEX = Symbol.prim("TupleIndex");
  public static final Symbol TUPLE_SLICE = Symbol.prim("TupleSlice");
  public static final Symbol DICT_INDEX = Symbol.prim("DictIndex");
  public static final Symbol LIST_UNPACK = Symbol.prim("ListUnpack");
  public static final Symbol PYTHON_OP = Symbol.prim("PythonOp");
  public static final Symbol GET_ATTR = Symbol.prim("GetAttr");
  public static final Symbol SET_ATTR = Symbol.prim("SetAttr");

  // Chunking
  public static final Symbol CONSTANT_CHUNK = Symbol.prim("ConstantChunk");
  public static final Symbol BROADCASTING_CHUNK = Symbol.prim("BroadcastingChunk");

  // Async
  public static final Symbol FORK = Symbol.prim("fork");
  public static final Symbol WAIT = Symbol.aten("wait");

  // Misc
  public static final Symbol PRINT = Symbol.prim("Print");
  public static final Symbol CALL_FUNCTION = Symbol.prim("CallFunction");
  public static final Symbol PROFILE = Symbol.prim("profile");
  public static final Symbol LOAD = Symbol.prim("Load");
  public static final Symbol STORE = Symbol.prim("Store");
  public static final Symbol DROP = Symbol.prim("Drop");
  public static final Symbol ONNX_RESHAPE = Symbol.onnx("Reshape");
  public static final Symbol ONNX_SHAPE = Symbol.onnx("Shape");

  // Arithmetic that may appear without a schema on primitive arguments
  public static final Symbol ADD = Symbol.aten("add");
  public static final Symbol SUB = Symbol.aten("sub");
  public static final Symbol MUL = Symbol.aten("mul");
  public static final Symbol DIV = Symbol.aten("div");

  // Attributes
  public static final Symbol ATTR_CHUNKS = Symbol.attr("chunks");
  public static final Symbol ATTR_SUBGRAPH = Symbol.attr("Subgraph");
  public static final Symbol ATTR_VALUE = Symbol.attr("value");
}
