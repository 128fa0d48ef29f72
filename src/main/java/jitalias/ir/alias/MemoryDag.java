package jitalias.ir.alias;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import jitalias.ir.Value;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePSet;
import org.pcollections.PSet;

/**
 * The points-to graph. An edge {@code a -> b} means that {@code a} may point to {@code b}. Elements
 * without outgoing edges are concrete memory locations; the memory locations of an element are all
 * such sinks reachable from it.
 *
 * <p>The graph is not necessarily acyclic: joins of control flow can make values point to each
 * other. So every traversal keeps a visited set.
 */
public class MemoryDag {

  /** Which edges a breadth-first search follows. */
  public enum Direction {
    POINTS_TO,
    POINTED_FROM,
    BOTH
  }

  private final List<Element> elements = new ArrayList<>();
  /** Invalidated on every change to a points-to edge. */
  private final Map<Element, PSet<Element>> memoryLocationCache = new HashMap<>();

  /** Creates a new element for {@code value} (null for a wildcard bucket) without any edges. */
  public Element makeFreshValue(@Nullable Value value) {
    Element element = new Element(elements.size(), value);
    elements.add(element);
    return element;
  }

  /** Adds the edge {@code from -> to}. Idempotent; self pointers are ignored. */
  public void makePointerTo(Element from, Element to) {
    if (from == to) {
      return;
    }
    if (from.pointsTo.add(to)) {
      to.pointedFrom.add(from);
      memoryLocationCache.clear();
    }
  }

  /** Records that {@code container} contains {@code elem}. */
  public void addToContainedElements(Element elem, Element container) {
    container.containedElements.add(elem);
  }

  public List<Element> elements() {
    return Collections.unmodifiableList(elements);
  }

  public int size() {
    return elements.size();
  }

  /**
   * All sinks reachable from {@code e}, which is {@code e} itself if it points nowhere. A cycle
   * without any exit is its own memory location.
   */
  public Set<Element> getMemoryLocations(Element e) {
    PSet<Element> cached = memoryLocationCache.get(e);
    if (cached != null) {
      return cached;
    }
    PSet<Element> locations = HashTreePSet.empty();
    Set<Element> reachable = bfs(Collections.singleton(e), Direction.POINTS_TO);
    for (Element reached : reachable) {
      if (reached.pointsTo.isEmpty()) {
        locations = locations.plus(reached);
      }
    }
    if (locations.isEmpty()) {
      locations = HashTreePSet.from(reachable);
    }
    memoryLocationCache.put(e, locations);
    return locations;
  }

  public boolean mayAlias(Element a, Element b) {
    return mayAlias(Collections.singleton(a), Collections.singleton(b));
  }

  /** Does any element of {@code a} share a memory location with any element of {@code b}? */
  public boolean mayAlias(Collection<Element> a, Collection<Element> b) {
    if (a.isEmpty() || b.isEmpty()) {
      return false;
    }
    Set<Element> locationsOfA = new HashSet<>();
    for (Element e : a) {
      locationsOfA.addAll(getMemoryLocations(e));
    }
    for (Element e : b) {
      for (Element location : getMemoryLocations(e)) {
        if (locationsOfA.contains(location)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Like {@link #mayAlias(Collection, Collection)}, but also considers everything the elements
   * (transitively) contain.
   */
  public boolean mayContainAlias(Collection<Element> a, Collection<Element> b) {
    if (a.isEmpty() || b.isEmpty()) {
      return false;
    }
    Set<Element> locationsOfA = collectAllContainedMemoryLocations(a);
    for (Element location : collectAllContainedMemoryLocations(b)) {
      if (locationsOfA.contains(location)) {
        return true;
      }
    }
    return false;
  }

  public boolean mayContainAlias(Element a, Element b) {
    return mayContainAlias(Collections.singleton(a), Collections.singleton(b));
  }

  /**
   * The memory locations of {@code roots} and of everything reachable from them through points-to
   * and containment edges.
   */
  public Set<Element> collectAllContainedMemoryLocations(Collection<Element> roots) {
    Set<Element> locations = new HashSet<>();
    Set<Element> visited = new HashSet<>();
    Deque<Element> toVisit = new ArrayDeque<>(roots);
    while (!toVisit.isEmpty()) {
      Element cur = toVisit.removeFirst();
      if (!visited.add(cur)) {
        continue;
      }
      for (Element location : getMemoryLocations(cur)) {
        locations.add(location);
        toVisit.addAll(location.containedElements);
      }
      toVisit.addAll(cur.containedElements);
    }
    return locations;
  }

  /** Breadth-first search from {@code roots}, returning the reached elements in visit order. */
  public Set<Element> bfs(Collection<Element> roots, Direction direction) {
    Set<Element> visited = new LinkedHashSet<>();
    Deque<Element> toVisit = new ArrayDeque<>(roots);
    while (!toVisit.isEmpty()) {
      Element cur = toVisit.removeFirst();
      if (!visited.add(cur)) {
        continue;
      }
      if (direction != Direction.POINTED_FROM) {
        toVisit.addAll(cur.pointsTo);
      }
      if (direction != Direction.POINTS_TO) {
        toVisit.addAll(cur.pointedFrom);
      }
    }
    return visited;
  }
}
