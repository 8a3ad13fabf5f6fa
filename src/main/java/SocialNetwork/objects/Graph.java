package SocialNetwork.objects;

import SocialNetwork.util.Constants;
import SocialNetwork.util.Logging;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;

import static SocialNetwork.objects.GraphException.Kind.*;

/**
 * Undirected friendship graph over a fixed number of vertex slots. Every
 * friendship is recorded twice: in the adjacency list of both endpoints, and
 * in the symmetric adjacency matrix. Both views are updated together by every
 * mutating operation.
 *
 * <p>Vertices are addressed by a dense index in {@code [0, size())}. Removing a
 * vertex compacts the table, so indices above the removed one shift down by one.
 */
public class Graph {
    private final int capacity;
    private final List<Vertex> vertices;
    private final boolean[][] adjacency;

    public Graph() {
        this(Constants.MAX_VERTICES);
    }

    public Graph(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.vertices = new ArrayList<>(capacity);
        this.adjacency = new boolean[capacity][capacity];
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return vertices.size();
    }

    public boolean isEmpty() {
        return vertices.isEmpty();
    }

    /**
     * Adds a person at the next free index.
     *
     * @param name  Unique, non-empty name. Compared case-sensitively.
     * @return      The index assigned to the new vertex.
     */
    public int insertVertex(String name) throws GraphException {
        if (name == null || name.isEmpty()) {
            throw new GraphException(INVALID_NAME, "Vertex name must not be empty");
        }
        if (vertices.size() >= capacity) {
            throw new GraphException(CAPACITY_EXCEEDED, "Vertex limit reached (" + capacity + ")");
        }
        if (indexOf(name) != -1) {
            throw new GraphException(DUPLICATE_NAME, "A vertex named '" + name + "' already exists");
        }
        vertices.add(new Vertex(name));
        int index = vertices.size() - 1;
        Logging.logDebug("Inserted vertex " + name + " at index " + index);
        return index;
    }

    /**
     * @return  Index of the vertex with exactly this name, or -1 if there is none.
     */
    public int indexOf(String name) {
        for (int i = 0; i < vertices.size(); i++) {
            if (vertices.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public int requireIndex(String name) throws GraphException {
        int index = indexOf(name);
        if (index == -1) {
            throw new GraphException(VERTEX_NOT_FOUND, "No vertex named '" + name + "'");
        }
        return index;
    }

    public void insertEdge(String first, String second) throws GraphException {
        int u = requireIndex(first);
        int v = requireIndex(second);
        insertEdge(u, v);
    }

    public void insertEdge(int u, int v) throws GraphException {
        checkIndex(u);
        checkIndex(v);
        if (u == v) {
            throw new GraphException(SELF_LOOP, "A vertex cannot be its own friend (" + u + ")");
        }
        if (adjacency[u][v]) {
            throw new GraphException(EDGE_EXISTS, "Edge " + new Edge(u, v) + " already exists");
        }
        vertices.get(u).adjacency().addFirst(v);
        vertices.get(v).adjacency().addFirst(u);
        adjacency[u][v] = true;
        adjacency[v][u] = true;
        Logging.logDebug("Inserted edge " + new Edge(u, v));
    }

    public void removeEdge(String first, String second) throws GraphException {
        int u = requireIndex(first);
        int v = requireIndex(second);
        removeEdge(u, v);
    }

    public void removeEdge(int u, int v) throws GraphException {
        checkIndex(u);
        checkIndex(v);
        if (!adjacency[u][v]) {
            throw new GraphException(EDGE_NOT_FOUND, "Edge " + new Edge(u, v) + " does not exist");
        }
        vertices.get(u).adjacency().removeFirstOccurrence(v);
        vertices.get(v).adjacency().removeFirstOccurrence(u);
        adjacency[u][v] = false;
        adjacency[v][u] = false;
        Logging.logDebug("Removed edge " + new Edge(u, v));
    }

    public void removeVertex(String name) throws GraphException {
        removeVertex(requireIndex(name));
    }

    /**
     * Removes the vertex at {@code target} and compacts the table. Every vertex
     * above {@code target} moves down one slot, and so do the matching matrix rows,
     * matrix columns and adjacency-list entries.
     */
    public void removeVertex(int target) throws GraphException {
        checkIndex(target);
        int n = vertices.size();

        // Drop target from the other adjacency lists
        for (int i = 0; i < n; i++) {
            if (i == target) continue;
            vertices.get(i).adjacency().removeIf(neighbor -> neighbor == target);
        }

        // Release the vertex itself; later vertices shift down
        Vertex removed = vertices.remove(target);
        removed.adjacency().clear();

        // Shift matrix rows, then columns, then clear the vacated row and column
        for (int i = target; i < n - 1; i++) {
            System.arraycopy(adjacency[i + 1], 0, adjacency[i], 0, n);
        }
        for (int i = 0; i < n - 1; i++) {
            System.arraycopy(adjacency[i], target + 1, adjacency[i], target, n - 1 - target);
        }
        for (int i = 0; i < n; i++) {
            adjacency[n - 1][i] = false;
            adjacency[i][n - 1] = false;
        }

        // Renumber references to vertices that moved
        for (Vertex vertex : vertices) {
            ListIterator<Integer> it = vertex.adjacency().listIterator();
            while (it.hasNext()) {
                int neighbor = it.next();
                if (neighbor > target) {
                    it.set(neighbor - 1);
                }
            }
        }
        Logging.logDebug("Removed vertex " + removed.getName() + " from index " + target);
    }

    /**
     * Removes every vertex and friendship.
     */
    public void clear() {
        int n = vertices.size();
        for (Vertex vertex : vertices) {
            vertex.adjacency().clear();
        }
        vertices.clear();
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                adjacency[i][j] = false;
            }
        }
    }

    public Vertex getVertex(int index) throws GraphException {
        checkIndex(index);
        return vertices.get(index);
    }

    public String nameOf(int index) throws GraphException {
        return getVertex(index).getName();
    }

    /**
     * @return  The vertices in index order.
     */
    public ImmutableList<Vertex> vertices() {
        return ImmutableList.copyOf(vertices);
    }

    /**
     * Neighbor indices of {@code index}, most recent friendship first. Used by
     * the traversals; returns an empty list for an out-of-range index.
     */
    public ImmutableList<Integer> neighborsOf(int index) {
        if (!isValidIndex(index)) {
            return ImmutableList.of();
        }
        return vertices.get(index).getNeighbors();
    }

    public ImmutableList<String> neighborNames(int index) throws GraphException {
        checkIndex(index);
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (Integer neighbor : vertices.get(index).adjacency()) {
            names.add(vertices.get(neighbor).getName());
        }
        return names.build();
    }

    /**
     * Constant-time edge lookup. Out-of-range indices have no edges.
     */
    public boolean hasEdge(int u, int v) {
        return isValidIndex(u) && isValidIndex(v) && adjacency[u][v];
    }

    /**
     * @return  A copy of the {@code size() x size()} adjacency matrix.
     */
    public boolean[][] adjacencyMatrix() {
        int n = vertices.size();
        boolean[][] copy = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            System.arraycopy(adjacency[i], 0, copy[i], 0, n);
        }
        return copy;
    }

    /**
     * All edges as {@code (u, v)} pairs with {@code u < v}, ordered by u and then v.
     */
    public ImmutableList<Edge> edges() {
        ImmutableList.Builder<Edge> edges = ImmutableList.builder();
        int n = vertices.size();
        for (int u = 0; u < n; u++) {
            for (int v = u + 1; v < n; v++) {
                if (adjacency[u][v]) {
                    edges.add(new Edge(u, v));
                }
            }
        }
        return edges.build();
    }

    public int edgeCount() {
        return edges().size();
    }

    /**
     * Vertex-by-edge table. Column {@code e} is set for both endpoints of
     * {@code edges().get(e)}.
     */
    public boolean[][] incidenceMatrix() {
        List<Edge> edges = edges();
        boolean[][] incidence = new boolean[vertices.size()][edges.size()];
        Iterator<Edge> it = edges.iterator();
        for (int e = 0; it.hasNext(); e++) {
            Edge edge = it.next();
            incidence[edge.getU()][e] = true;
            incidence[edge.getV()][e] = true;
        }
        return incidence;
    }

    public boolean isValidIndex(int index) {
        return index >= 0 && index < vertices.size();
    }

    private void checkIndex(int index) throws GraphException {
        if (!isValidIndex(index)) {
            throw new GraphException(INVALID_INDEX,
                    "Index " + index + " is outside [0, " + vertices.size() + ")");
        }
    }
}
