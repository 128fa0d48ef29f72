package jitalias.ir.alias;

import static org.jooq.lambda.Seq.seq;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import jitalias.EnvVar;
import jitalias.ir.Block;
import jitalias.ir.Graph;
import jitalias.ir.Node;
import jitalias.ir.Symbol;
import jitalias.ir.Symbols;
import jitalias.ir.Value;
import jitalias.ir.schema.AliasInfo;
import jitalias.ir.schema.Argument;
import jitalias.ir.schema.FunctionSchema;
import jitalias.ir.types.Type;
import jitalias.ir.types.TypeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers may-alias and may-write questions about the values and nodes of a {@link Graph}.
 *
 * <p>The graph is analyzed once on construction. Every value of a mutable type (see {@link
 * MutableTypes}) gets an {@link Element} in a {@link MemoryDag}; two values may alias if their
 * elements share a memory location. Operators describe their aliasing behavior through the alias
 * annotations of their {@link FunctionSchema}; control flow, containers and a few other kinds are
 * handled specifically (see {@link SpecialCase}).
 *
 * <p>Values we know nothing about (graph inputs, things extracted from containers, results of
 * custom operators) are sent to the <em>wildcard bucket</em> of their kind. All values in the same
 * bucket may alias each other.
 *
 * <p>The database stays valid when nodes are reordered, as that doesn't change value identities.
 * Any other change to the graph requires a new database.
 */
public class AliasDb {

  private static final Logger LOGGER = LoggerFactory.getLogger("AliasDb");

  private final Graph graph;
  private final MemoryDag memoryDag = new MemoryDag();
  private final Map<Value, Element> elementMap = new LinkedHashMap<>();
  /** Values directly written by a node. */
  private final Map<Node, Set<Value>> writeIndex = new LinkedHashMap<>();
  /** Wildcard buckets directly written by a node (wait nodes). */
  private final Map<Node, Set<TypeKind>> wildcardWriteIndex = new LinkedHashMap<>();
  private final Map<TypeKind, Element> wildcardIndex = new EnumMap<>(TypeKind.class);
  /** Subgraphs of FusionGroup and the like, mapped to the node owning them. */
  private final Map<Graph, Node> subgraphToOwner = new HashMap<>();

  /** All memory locations written by some node. Rebuilt lazily when stale. */
  private final Set<Element> writeCache = new HashSet<>();
  private boolean isWriteCacheStale = true;

  public AliasDb(Graph graph) {
    this.graph = graph;
    analyze(graph);
    LOGGER.debug(
        "Built alias db: {} tracked values, {} writers, {} wildcard buckets",
        elementMap.size(),
        writeIndex.size() + wildcardWriteIndex.size(),
        wildcardIndex.size());
    if (EnvVar.JITALIAS_DUMP_ALIAS_DB.isSetToOne()) {
      LOGGER.info(dump());
    }
  }

  public Graph graph() {
    return graph;
  }

  public MemoryDag memoryDag() {
    return memoryDag;
  }

  // Queries

  /** Does any node write to a memory location {@code value} may refer to? */
  public boolean hasWriters(Value value) {
    if (!elementMap.containsKey(value) || value.mustBeNone()) {
      return false;
    }
    if (isWriteCacheStale) {
      rebuildWriteCache();
    }
    for (Element location : memoryDag.getMemoryLocations(elementMap.get(value))) {
      if (writeCache.contains(location)) {
        return true;
      }
    }
    return false;
  }

  /** Does any input or output of {@code node} have writers? */
  public boolean hasWriters(Node node) {
    return seq(node.inputs()).concat(node.outputs()).anyMatch(this::hasWriters);
  }

  /** Does {@code node} write to anything? */
  public boolean hasWrites(Node node) {
    return writeIndex.containsKey(node) || wildcardWriteIndex.containsKey(node);
  }

  /** The values written by {@code node} and, if {@code recurseBlocks}, by its nested nodes. */
  public Set<Value> getWrites(Node node, boolean recurseBlocks) {
    Set<Value> writes = new LinkedHashSet<>();
    collectWrites(node, recurseBlocks, writes);
    return writes;
  }

  private void collectWrites(Node node, boolean recurseBlocks, Set<Value> writes) {
    writes.addAll(writeIndex.getOrDefault(node, Collections.emptySet()));
    if (recurseBlocks) {
      for (Node nested : nestedNodes(node)) {
        collectWrites(nested, true, writes);
      }
    }
  }

  /** The kinds of wildcard buckets {@code node} writes to directly. */
  public Set<TypeKind> getWildcardWrites(Node node, boolean recurseBlocks) {
    Set<TypeKind> kinds = EnumSet.noneOf(TypeKind.class);
    collectWildcardWrites(node, recurseBlocks, kinds);
    return kinds;
  }

  private void collectWildcardWrites(Node node, boolean recurseBlocks, Set<TypeKind> kinds) {
    kinds.addAll(wildcardWriteIndex.getOrDefault(node, Collections.emptySet()));
    if (recurseBlocks) {
      for (Node nested : nestedNodes(node)) {
        collectWildcardWrites(nested, true, kinds);
      }
    }
  }

  /** The values {@code node} (and, if {@code recurseBlocks}, its nested nodes) reads. */
  public Set<Value> getReads(Node node, boolean recurseBlocks) {
    Set<Value> reads = new LinkedHashSet<>();
    collectReads(node, recurseBlocks, reads);
    return reads;
  }

  private void collectReads(Node node, boolean recurseBlocks, Set<Value> reads) {
    reads.addAll(node.inputs());
    reads.addAll(node.outputs());
    if (recurseBlocks) {
      for (Node nested : nestedNodes(node)) {
        collectReads(nested, true, reads);
      }
    }
  }

  /** The nodes of sub-blocks and of an analyzed subgraph, one level deep. */
  private List<Node> nestedNodes(Node node) {
    List<Node> nested = new ArrayList<>();
    for (Block block : node.blocks()) {
      nested.addAll(block.nodes());
    }
    if (node.hasAttribute(Symbols.ATTR_SUBGRAPH)) {
      Graph subgraph = node.g(Symbols.ATTR_SUBGRAPH);
      if (subgraphToOwner.get(subgraph) == node) {
        nested.addAll(subgraph.block().nodes());
      }
    }
    return nested;
  }

  /** Does {@code node} write to a memory location any of {@code values} may refer to? */
  public boolean writesToAlias(Node node, Collection<Value> values, boolean recurseBlocks) {
    return mayAlias(getWrites(node, recurseBlocks), values)
        || mayAliasWildcard(values, getWildcardWrites(node, recurseBlocks));
  }

  public boolean mayAlias(Value a, Value b) {
    if (!MutableTypes.shouldAnnotate(a) || !MutableTypes.shouldAnnotate(b)) {
      return false;
    }
    return memoryDag.mayAlias(elementFor(a), elementFor(b));
  }

  public boolean mayAlias(Collection<Value> a, Collection<Value> b) {
    return memoryDag.mayAlias(annotatedElements(a), annotatedElements(b));
  }

  /**
   * Does {@code a} or anything contained in {@code a} alias {@code b} or anything contained in
   * {@code b}?
   */
  public boolean mayContainAlias(Value a, Value b) {
    return mayContainAlias(Collections.singletonList(a), Collections.singletonList(b));
  }

  public boolean mayContainAlias(Collection<Value> a, Collection<Value> b) {
    if (seq(a).concat(b).anyMatch(this::cannotCheckAliasContainment)) {
      return true;
    }
    List<Element> elementsOfA = annotatedElements(a);
    if (elementsOfA.isEmpty()) {
      return false;
    }
    return memoryDag.mayContainAlias(elementsOfA, annotatedElements(b));
  }

  /**
   * We only know what's in a container if it was built by a TupleConstruct from values whose
   * contents we know in turn.
   */
  private boolean cannotCheckAliasContainment(Value value) {
    if (!MutableTypes.isContainerType(value.type())) {
      return false;
    }
    Node producer = value.node();
    if (!producer.kind().equals(Symbols.TUPLE_CONSTRUCT)) {
      return true;
    }
    return seq(producer.inputs()).anyMatch(this::cannotCheckAliasContainment);
  }

  /** Does {@code value} reach the wildcard bucket of its kind? */
  public boolean mayAliasWildcard(Value value) {
    Optional<TypeKind> kind = MutableTypes.mutableKind(value.type());
    if (!kind.isPresent() || !wildcardIndex.containsKey(kind.get())) {
      return false;
    }
    return memoryDag.mayAlias(elementFor(value), wildcardIndex.get(kind.get()));
  }

  /** Does any of {@code values} reach one of the wildcard buckets of {@code kinds}? */
  public boolean mayAliasWildcard(Collection<Value> values, Set<TypeKind> kinds) {
    List<Element> buckets =
        seq(kinds).filter(wildcardIndex::containsKey).map(wildcardIndex::get).toList();
    return memoryDag.mayAlias(annotatedElements(values), buckets);
  }

  /** Does {@code node} write to something that may alias a wildcard? */
  public boolean writesToWildcard(Node node) {
    if (wildcardWriteIndex.containsKey(node)) {
      return true;
    }
    return seq(writeIndex.getOrDefault(node, Collections.emptySet()))
        .anyMatch(this::mayAliasWildcard);
  }

  /** Does {@code node} write to something that may alias an input of the graph? */
  public boolean writesToInputAlias(Node node) {
    List<Value> mutableInputs = seq(graph.inputs()).filter(MutableTypes::shouldAnnotate).toList();
    return writesToAlias(node, mutableInputs, false);
  }

  /** Are there effects of {@code node} that are observable outside of the graph? */
  public boolean hasUntrackedEffects(Node node) {
    return writesToInputAlias(node) || writesToWildcard(node);
  }

  /** All tracked values sharing a memory location with {@code value}, including itself. */
  public Set<Value> getAliases(Value value) {
    Set<Value> aliases = new LinkedHashSet<>();
    if (!elementMap.containsKey(value)) {
      return aliases;
    }
    Set<Element> locations = memoryDag.getMemoryLocations(elementMap.get(value));
    for (Element e : memoryDag.bfs(locations, MemoryDag.Direction.POINTED_FROM)) {
      if (e.value != null) {
        aliases.add(e.value);
      }
    }
    return aliases;
  }

  /** All nodes writing to something that an input or output of {@code node} may alias. */
  public Set<Node> getWriters(Node node) {
    Set<Value> reads = getReads(node, false);
    Set<Node> writers = new LinkedHashSet<>();
    for (Map.Entry<Node, Set<Value>> entry : writeIndex.entrySet()) {
      if (mayAlias(entry.getValue(), reads)) {
        writers.add(entry.getKey());
      }
    }
    for (Map.Entry<Node, Set<TypeKind>> entry : wildcardWriteIndex.entrySet()) {
      if (mayAliasWildcard(reads, entry.getValue())) {
        writers.add(entry.getKey());
      }
    }
    return writers;
  }

  /**
   * Is there a writer to any of {@code node}'s values that runs before {@code node}? Writers in
   * subgraphs are compared through the node owning the subgraph.
   */
  public boolean hasWritersBefore(Node node) {
    return seq(getWriters(node)).anyMatch(writer -> isBeforeSameGraph(writer, node));
  }

  private boolean isBeforeSameGraph(Node lhs, Node rhs) {
    Node lifted = lhs;
    while (lifted.owningGraph() != rhs.owningGraph()) {
      lifted = subgraphToOwner.get(lifted.owningGraph());
      if (lifted == null) {
        return false;
      }
    }
    if (lifted == rhs || isNestedIn(lifted, rhs)) {
      return false;
    }
    if (isNestedIn(rhs, lifted)) {
      // lhs executes around rhs, so some of its writes might come first.
      return true;
    }
    return lifted.isBefore(rhs);
  }

  private static boolean isNestedIn(Node inner, Node outer) {
    for (Block b = inner.owningBlock(); b != null && b.owningNode() != null; ) {
      Node owner = b.owningNode();
      if (owner == outer) {
        return true;
      }
      b = owner.owningBlock();
    }
    return false;
  }

  /** A textual dump of the graph, points-to graph and write index. */
  public String dump() {
    return AliasDbPrinter.print(this);
  }

  @Override
  public String toString() {
    return dump();
  }

  // For AliasDbPrinter

  Map<Value, Element> elementMap() {
    return Collections.unmodifiableMap(elementMap);
  }

  Map<Node, Set<Value>> writeIndex() {
    return Collections.unmodifiableMap(writeIndex);
  }

  Map<Node, Set<TypeKind>> wildcardWriteIndex() {
    return Collections.unmodifiableMap(wildcardWriteIndex);
  }

  Map<TypeKind, Element> wildcardIndex() {
    return Collections.unmodifiableMap(wildcardIndex);
  }

  private Element elementFor(Value value) {
    Element element = elementMap.get(value);
    Preconditions.checkState(element != null, "%s has no alias information", value);
    return element;
  }

  private List<Element> annotatedElements(Collection<Value> values) {
    return seq(values).filter(MutableTypes::shouldAnnotate).map(this::elementFor).toList();
  }

  private void rebuildWriteCache() {
    writeCache.clear();
    for (Set<Value> written : writeIndex.values()) {
      for (Value value : written) {
        writeCache.addAll(memoryDag.getMemoryLocations(elementFor(value)));
      }
    }
    for (Set<TypeKind> kinds : wildcardWriteIndex.values()) {
      for (TypeKind kind : kinds) {
        writeCache.addAll(memoryDag.getMemoryLocations(wildcardIndex.get(kind)));
      }
    }
    isWriteCacheStale = false;
  }

  // Analysis

  private void analyze(Graph graph) {
    // Whoever calls us may hold on to the inputs.
    for (Value input : graph.inputs()) {
      setWildcard(input);
    }
    analyze(graph.block());
  }

  private void analyze(Block block) {
    for (Node node : block.nodes()) {
      analyze(node);
    }
  }

  private void analyze(Node node) {
    Optional<SpecialCase> special = SpecialCase.forKind(node.kind());
    if (special.isPresent()) {
      if (analyzeSpecialCase(node, special.get())) {
        return;
      }
    } else {
      if (tryRegisteredAnalysis(node)) {
        return;
      }
      Preconditions.checkState(
          !SpecialCase.hasSpecialCaseFor(node.kind()),
          "%s is in the list of specially handled kinds, but isn't handled",
          node.kind());
    }

    Optional<FunctionSchema> schema = node.maybeSchema();
    if (schema.isPresent()
        && (schema.get().isVararg() || schema.get().isVarret())
        && seq(node.outputs()).anyMatch(MutableTypes::shouldAnnotate)) {
      throw new AliasAnalysisError(
          "Alias information not found for node. File a bug report.\n"
              + "Vararg/varret schemas with mutable outputs need a special handler",
          node);
    }
    if (!isBuiltin(node.kind())) {
      analyzeCustomOp(node);
      return;
    }
    if (!schema.isPresent()) {
      throw new AliasAnalysisError("Alias information not found for node", node);
    }
    analyzeSchema(node, schema.get());
  }

  /** Returns true if the alias analysis kind registered with the operator settled the node. */
  private boolean tryRegisteredAnalysis(Node node) {
    Optional<FunctionSchema> schema = node.maybeSchema();
    if (!schema.isPresent()) {
      return false;
    }
    switch (schema.get().aliasAnalysis()) {
      case PURE:
        analyzeCreator(node);
        return true;
      case FROM_SCHEMA:
        return false;
      default:
        throw new AssertionError("Unhandled alias analysis kind " + schema.get().aliasAnalysis());
    }
  }

  private static boolean isBuiltin(Symbol kind) {
    return kind.isAten() || kind.isPrim();
  }

  /** Returns false if the node should be analyzed through its schema after all. */
  private boolean analyzeSpecialCase(Node node, SpecialCase special) {
    switch (special) {
      case IF:
        analyzeIf(node);
        return true;
      case LOOP:
        analyzeLoop(node);
        return true;
      case SUBGRAPH:
        analyzeSubgraph(node);
        return true;
      case GRAD_OF:
        analyzeGradOf(node);
        return true;
      case CREATOR:
        analyzeCreator(node);
        return true;
      case CONTAINER_CONSTRUCT:
        analyzeContainerConstruct(node);
        return true;
      case TUPLE_CONSTRUCT:
        analyzeTupleConstruct(node);
        return true;
      case EXTRACTOR:
        analyzeExtractor(node);
        return true;
      case CHUNK:
        analyzeChunk(node);
        return true;
      case BROADCASTING_CHUNK:
        analyzeBroadcastingChunk(node);
        return true;
      case SET_ATTR:
        analyzeSetAttr(node);
        return true;
      case FORK:
        analyzeFork(node);
        return true;
      case WAIT:
        analyzeWait(node);
        return true;
      case NO_OP:
        return true;
      case CALL_FUNCTION:
        throw new AliasAnalysisError("Alias summaries are required to support this feature", node);
      case PROFILE:
        throw new AliasAnalysisError("Analyzing prim::profile isn't yet implemented", node);
      case ARITHMETIC:
        if (node.maybeSchema().isPresent()) {
          return false;
        }
        analyzeCreator(node);
        return true;
      default:
        throw new AssertionError("Unhandled special case " + special);
    }
  }

  private void analyzeSchema(Node node, FunctionSchema schema) {
    Map<Symbol, Value> formalToActual = new HashMap<>();
    List<Argument> formals = schema.arguments();
    for (int i = 0; i < formals.size() && i < node.inputs().size(); ++i) {
      Optional<AliasInfo> aliasInfo = formals.get(i).aliasInfo();
      Value actual = node.input(i);
      if (!aliasInfo.isPresent() || !MutableTypes.shouldAnnotate(actual)) {
        continue;
      }
      AliasInfo info = aliasInfo.get();
      Preconditions.checkState(
          info.containedTypes().isEmpty(), "Composite types for alias analysis not yet supported");
      Preconditions.checkState(
          !info.isWildcardBefore(), "Wildcards in the before set of an argument are not supported");

      formalToActual.putIfAbsent(info.beforeSet(), actual);
      if (info.isWrite()) {
        registerWrite(actual, node);
      }
      if (info.isWildcardAfter()) {
        setWildcard(actual);
      } else {
        Preconditions.checkState(
            info.beforeSets().equals(info.afterSets()),
            "Moving an alias set across a call isn't supported: %s",
            info);
      }
    }

    List<Argument> returns = schema.returns();
    for (int i = 0; i < returns.size() && i < node.outputs().size(); ++i) {
      Value actual = node.output(i);
      Optional<AliasInfo> aliasInfo = returns.get(i).aliasInfo();
      if (!aliasInfo.isPresent()) {
        giveFreshAlias(actual);
        continue;
      }
      if (!MutableTypes.shouldAnnotate(actual)) {
        continue;
      }
      AliasInfo info = aliasInfo.get();
      if (info.isWildcardBefore() || info.isWildcardAfter()) {
        setWildcard(actual);
        continue;
      }
      for (Symbol formal : info.beforeSets()) {
        Value bound = formalToActual.get(formal);
        if (bound != null) {
          makePointerTo(actual, bound);
        } else if (info.beforeSets().size() == 1) {
          // foo(Tensor(a) x) -> Tensor(b)
          giveFreshAlias(actual);
        }
      }
      if (!elementMap.containsKey(actual)) {
        // No member of a union was bound, so all we know is that we don't know.
        setWildcard(actual);
      }
      if (info.isWrite()) {
        registerWrite(actual, node);
      }
    }
    // Outputs beyond the declared returns don't alias anything.
    for (int i = returns.size(); i < node.outputs().size(); ++i) {
      giveFreshAlias(node.output(i));
    }
  }

  private void analyzeIf(Node node) {
    Preconditions.checkState(node.blocks().size() == 2, "If needs two blocks: %s", node);
    Block trueBlock = node.blocks().get(0);
    Block falseBlock = node.blocks().get(1);
    analyze(trueBlock);
    analyze(falseBlock);
    for (int i = 0; i < node.outputs().size(); ++i) {
      Value output = node.output(i);
      makePointerTo(output, trueBlock.outputs().get(i));
      makePointerTo(output, falseBlock.outputs().get(i));
    }
  }

  /**
   * Inputs are {@code (maxTripCount, condition, carried...)}, body inputs {@code (tripCount,
   * carried...)} and body outputs {@code (condition, carried...)}.
   */
  private void analyzeLoop(Node node) {
    Preconditions.checkState(node.blocks().size() == 1, "Loop needs a body: %s", node);
    Block body = node.blocks().get(0);
    List<Value> carried = node.inputs().subList(2, node.inputs().size());
    List<Value> bodyCarried = body.inputs().subList(1, body.inputs().size());
    List<Value> bodyOutputs = body.outputs().subList(1, body.outputs().size());
    Preconditions.checkState(
        carried.size() == bodyCarried.size() && bodyOutputs.size() == node.outputs().size(),
        "malformed loop %s",
        node);

    mapAliases(bodyCarried, carried);
    analyze(body);
    mapAliases(node.outputs(), bodyOutputs);
  }

  private void analyzeSubgraph(Node node) {
    Graph subgraph = node.g(Symbols.ATTR_SUBGRAPH);
    subgraphToOwner.put(subgraph, node);
    Preconditions.checkState(
        subgraph.inputs().size() == node.inputs().size(),
        "subgraph of %s has %s inputs",
        node,
        subgraph.inputs().size());
    mapAliases(subgraph.inputs(), node.inputs());
    analyze(subgraph.block());

    // A subgraph may have more outputs than the node, e.g. intermediates for the backward pass.
    List<Value> subgraphOutputs = subgraph.outputs();
    Preconditions.checkState(
        subgraphOutputs.size() >= node.outputs().size(), "subgraph of %s lacks outputs", node);
    for (int i = 0; i < node.outputs().size(); ++i) {
      makePointerTo(node.output(i), subgraphOutputs.get(i));
    }
  }

  private void analyzeGradOf(Node node) {
    Block block = node.blocks().get(0);
    analyze(block);
    mapAliases(node.outputs(), block.outputs());
  }

  private void analyzeCreator(Node node) {
    for (Value output : node.outputs()) {
      giveFreshAlias(output);
    }
  }

  /** The container is fresh, but we lose track of what's inside. */
  private void analyzeContainerConstruct(Node node) {
    for (Value input : node.inputs()) {
      setWildcard(input);
    }
    for (Value output : node.outputs()) {
      giveFreshAlias(output);
    }
  }

  private void analyzeTupleConstruct(Node node) {
    Value tuple = node.output();
    getOrCreateElement(tuple);
    for (Value input : node.inputs()) {
      addToContainedElements(input, tuple);
    }
  }

  private void analyzeExtractor(Node node) {
    for (Value output : node.outputs()) {
      setWildcard(output);
    }
  }

  private void analyzeChunk(Node node) {
    for (Value output : node.outputs()) {
      makePointerTo(output, node.input());
    }
  }

  private void analyzeBroadcastingChunk(Node node) {
    int chunks = Math.toIntExact(node.i(Symbols.ATTR_CHUNKS));
    List<Value> inputs = node.inputs();
    Preconditions.checkState(
        node.outputs().size() == inputs.size() * chunks,
        "%s needs %s outputs per input",
        node,
        chunks);
    for (int i = 0; i < inputs.size(); ++i) {
      for (int j = 0; j < chunks; ++j) {
        makePointerTo(node.output(i * chunks + j), inputs.get(i));
      }
    }
  }

  /** {@code SetAttr(self, value)} writes to the object, which now holds on to the value. */
  private void analyzeSetAttr(Node node) {
    Value self = node.input(0);
    Preconditions.checkArgument(
        self.type().kind() == TypeKind.CLASS, "SetAttr on non-object %s", self);
    registerWrite(self, node);
    setWildcard(node.input(1));
  }

  /** The future is fresh, but the forked task may do anything with the inputs. */
  private void analyzeFork(Node node) {
    for (Value input : node.inputs()) {
      setWildcard(input);
    }
    for (Value output : node.outputs()) {
      giveFreshAlias(output);
    }
  }

  /** Waiting on a future means the forked task may have written to everything it could see. */
  private void analyzeWait(Node node) {
    for (Value output : node.outputs()) {
      setWildcard(output);
    }
    for (TypeKind kind : wildcardIndex.keySet()) {
      registerWildcardWrite(kind, node);
    }
  }

  private void analyzeCustomOp(Node node) {
    for (Value input : node.inputs()) {
      registerWrite(input, node);
    }
    for (Value output : node.outputs()) {
      setWildcard(output);
    }
  }

  // DAG manipulation

  /** Makes each value of {@code from} point to the corresponding value of {@code to}. */
  private void mapAliases(List<Value> from, List<Value> to) {
    Preconditions.checkState(from.size() == to.size(), "can't map %s to %s", from, to);
    for (int i = 0; i < from.size(); ++i) {
      makePointerTo(from.get(i), to.get(i));
    }
  }

  private void makePointerTo(Value from, Value to) {
    if (!MutableTypes.shouldAnnotate(from)) {
      Verify.verify(
          !MutableTypes.shouldAnnotate(to), "immutable %s can't point to mutable %s", from, to);
      return;
    }
    if (from == to) {
      return;
    }
    // An optional that is None doesn't point anywhere, but is still tracked.
    if (from.type().kind() == TypeKind.OPTIONAL && to.type().kind() == TypeKind.NONE) {
      getOrCreateElement(from);
      return;
    }
    Verify.verify(MutableTypes.shouldAnnotate(to), "mutable %s can't point to %s", from, to);
    memoryDag.makePointerTo(getOrCreateElement(from), getOrCreateElement(to));
    isWriteCacheStale = true;
  }

  private void addToContainedElements(Value elem, Value container) {
    if (!MutableTypes.shouldAnnotate(elem)) {
      return;
    }
    Verify.verify(
        MutableTypes.isContainerType(container.type()), "%s is not a container", container);
    memoryDag.addToContainedElements(getOrCreateElement(elem), getOrCreateElement(container));
  }

  private void giveFreshAlias(Value value) {
    if (!MutableTypes.shouldAnnotate(value) || elementMap.containsKey(value)) {
      return;
    }
    elementMap.put(value, memoryDag.makeFreshValue(value));
  }

  private Element getOrCreateElement(Value value) {
    giveFreshAlias(value);
    return elementFor(value);
  }

  private void setWildcard(Value value) {
    if (!MutableTypes.shouldAnnotate(value)) {
      return;
    }
    memoryDag.makePointerTo(getOrCreateElement(value), getOrCreateWildcard(value.type()));
    isWriteCacheStale = true;
  }

  private Element getOrCreateWildcard(Type type) {
    TypeKind kind =
        MutableTypes.mutableKind(type)
            .orElseThrow(() -> new IllegalStateException("no wildcard for immutable " + type));
    return wildcardIndex.computeIfAbsent(kind, k -> memoryDag.makeFreshValue(null));
  }

  private void registerWrite(Value value, Node writer) {
    if (!MutableTypes.shouldAnnotate(value)) {
      return;
    }
    Verify.verify(elementMap.containsKey(value), "written value %s has no element", value);
    writeIndex.computeIfAbsent(writer, n -> new LinkedHashSet<>()).add(value);
    isWriteCacheStale = true;
  }

  private void registerWildcardWrite(TypeKind kind, Node writer) {
    wildcardWriteIndex.computeIfAbsent(writer, n -> EnumSet.noneOf(TypeKind.class)).add(kind);
    isWriteCacheStale = true;
  }
}
