package SocialNetwork.objects;

import SocialNetwork.util.TestObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static SocialNetwork.objects.GraphException.Kind.*;

class GraphTest {

    /**
     * Checks that the matrix is symmetric with an empty diagonal and that every
     * adjacency list names exactly the neighbors in its matrix row.
     */
    private static void assertConsistent(Graph graph) {
        boolean[][] matrix = graph.adjacencyMatrix();
        for (int i = 0; i < graph.size(); i++) {
            Assertions.assertFalse(matrix[i][i], "self loop at " + i);
            Set<Integer> row = new HashSet<>();
            for (int j = 0; j < graph.size(); j++) {
                Assertions.assertEquals(matrix[i][j], matrix[j][i], "asymmetric at " + i + "," + j);
                if (matrix[i][j]) row.add(j);
            }
            List<Integer> list = graph.neighborsOf(i);
            Assertions.assertEquals(list.size(), new HashSet<>(list).size(), "duplicate neighbor at " + i);
            Assertions.assertEquals(row, new HashSet<>(list), "list and matrix differ at " + i);
        }
    }

    @Test
    void testInsertVertexAppendsAtNextIndex() throws GraphException {
        Graph graph = new Graph();
        Assertions.assertEquals(0, graph.insertVertex("Alice"));
        Assertions.assertEquals(1, graph.insertVertex("Bob"));
        Assertions.assertEquals(2, graph.size());
        Assertions.assertEquals("Bob", graph.nameOf(1));
        Assertions.assertTrue(graph.neighborsOf(1).isEmpty());
    }

    @Test
    void testDuplicateNameRejected() throws GraphException {
        Graph graph = TestObjects.graphWith("Alice", "Bob");
        GraphException ex = Assertions.assertThrows(GraphException.class, () -> graph.insertVertex("Alice"));
        Assertions.assertEquals(DUPLICATE_NAME, ex.getKind());
        Assertions.assertEquals(2, graph.size());
    }

    @Test
    void testNamesAreCaseSensitive() throws GraphException {
        Graph graph = TestObjects.graphWith("alice");
        Assertions.assertEquals(1, graph.insertVertex("Alice"));
        Assertions.assertEquals(0, graph.indexOf("alice"));
        Assertions.assertEquals(1, graph.indexOf("Alice"));
        Assertions.assertEquals(-1, graph.indexOf("ALICE"));
    }

    @Test
    void testEmptyNameRejected() {
        Graph graph = new Graph();
        GraphException ex = Assertions.assertThrows(GraphException.class, () -> graph.insertVertex(""));
        Assertions.assertEquals(INVALID_NAME, ex.getKind());
        Assertions.assertTrue(graph.isEmpty());
    }

    @Test
    void testCapacityExceeded() throws GraphException {
        Graph graph = TestObjects.fullGraph(20);
        GraphException ex = Assertions.assertThrows(GraphException.class, () -> graph.insertVertex("X"));
        Assertions.assertEquals(CAPACITY_EXCEEDED, ex.getKind());
        Assertions.assertEquals(20, graph.size());
        Assertions.assertEquals(-1, graph.indexOf("X"));
    }

    @Test
    void testCustomCapacity() throws GraphException {
        Graph graph = TestObjects.fullGraph(3);
        Assertions.assertEquals(3, graph.capacity());
        GraphException ex = Assertions.assertThrows(GraphException.class, () -> graph.insertVertex("X"));
        Assertions.assertEquals(CAPACITY_EXCEEDED, ex.getKind());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new Graph(0));
    }

    @Test
    void testInsertEdgeUpdatesBothViews() throws GraphException {
        Graph graph = TestObjects.graphWith("A", "B", "C");
        graph.insertEdge(0, 2);

        Assertions.assertTrue(graph.hasEdge(0, 2));
        Assertions.assertTrue(graph.hasEdge(2, 0));
        Assertions.assertFalse(graph.hasEdge(0, 1));
        Assertions.assertEquals(ImmutableList.of(2), graph.neighborsOf(0));
        Assertions.assertEquals(ImmutableList.of(0), graph.neighborsOf(2));
        assertConsistent(graph);
    }

    @Test
    void testNewestEdgeIsFirstInList() throws GraphException {
        Graph graph = TestObjects.graphWith("A", "B", "C", "D");
        graph.insertEdge("A", "B");
        graph.insertEdge("A", "C");
        graph.insertEdge("D", "A");
        Assertions.assertEquals(ImmutableList.of(3, 2, 1), graph.neighborsOf(0));
        Assertions.assertEquals(ImmutableList.of("D", "C", "B"), graph.neighborNames(0));
    }

    @Test
    void testInsertEdgeErrors() throws GraphException {
        Graph graph = TestObjects.graphWith("A", "B");
        graph.insertEdge(0, 1);

        Assertions.assertEquals(INVALID_INDEX,
                Assertions.assertThrows(GraphException.class, () -> graph.insertEdge(0, 2)).getKind());
        Assertions.assertEquals(INVALID_INDEX,
                Assertions.assertThrows(GraphException.class, () -> graph.insertEdge(-1, 0)).getKind());
        Assertions.assertEquals(SELF_LOOP,
                Assertions.assertThrows(GraphException.class, () -> graph.insertEdge(1, 1)).getKind());
        Assertions.assertEquals(EDGE_EXISTS,
                Assertions.assertThrows(GraphException.class, () -> graph.insertEdge(1, 0)).getKind());
        Assertions.assertEquals(VERTEX_NOT_FOUND,
                Assertions.assertThrows(GraphException.class, () -> graph.insertEdge("A", "Z")).getKind());
        Assertions.assertEquals(1, graph.edgeCount());
        assertConsistent(graph);
    }

    @Test
    void testInsertThenRemoveEdgeRestoresState() throws GraphException {
        Graph graph = TestObjects.sampleGraph();
        boolean[][] matrixBefore = graph.adjacencyMatrix();
        List<ImmutableList<Integer>> listsBefore = new ArrayList<>();
        for (int i = 0; i < graph.size(); i++) listsBefore.add(graph.neighborsOf(i));

        graph.insertEdge("Alice", "Frank");
        Assertions.assertTrue(graph.hasEdge(0, 5));
        graph.removeEdge("Alice", "Frank");

        Assertions.assertArrayEquals(matrixBefore, graph.adjacencyMatrix());
        for (int i = 0; i < graph.size(); i++) {
            Assertions.assertEquals(listsBefore.get(i), graph.neighborsOf(i));
        }
    }

    @Test
    void testRemoveEdgeErrors() throws GraphException {
        Graph graph = TestObjects.graphWith("A", "B");
        Assertions.assertEquals(EDGE_NOT_FOUND,
                Assertions.assertThrows(GraphException.class, () -> graph.removeEdge(0, 1)).getKind());
        Assertions.assertEquals(INVALID_INDEX,
                Assertions.assertThrows(GraphException.class, () -> graph.removeEdge(0, 5)).getKind());
        Assertions.assertEquals(VERTEX_NOT_FOUND,
                Assertions.assertThrows(GraphException.class, () -> graph.removeEdge("Z", "A")).getKind());
    }

    @Test
    void testRemoveMiddleOfPath() throws GraphException {
        Graph graph = TestObjects.pathGraph("A", "B", "C");
        graph.removeVertex("B");

        Assertions.assertEquals(2, graph.size());
        Assertions.assertEquals(0, graph.indexOf("A"));
        Assertions.assertEquals(1, graph.indexOf("C"));
        Assertions.assertEquals(-1, graph.indexOf("B"));
        Assertions.assertFalse(graph.hasEdge(0, 1));
        Assertions.assertEquals(0, graph.edgeCount());
        assertConsistent(graph);
    }

    @Test
    void testRemoveVertexRenumbersSurvivingEdges() throws GraphException {
        Graph graph = TestObjects.sampleGraph();
        int removed = graph.indexOf("Bob");
        Set<Set<String>> expected = new HashSet<>();
        for (Edge edge : graph.edges()) {
            if (!edge.touches(removed)) {
                expected.add(ImmutableSet.of(graph.nameOf(edge.getU()), graph.nameOf(edge.getV())));
            }
        }

        graph.removeVertex(removed);

        Set<Set<String>> actual = new HashSet<>();
        for (Edge edge : graph.edges()) {
            actual.add(ImmutableSet.of(graph.nameOf(edge.getU()), graph.nameOf(edge.getV())));
        }
        Assertions.assertEquals(expected, actual);
        Assertions.assertEquals(expected.size(), graph.edgeCount());
        Assertions.assertEquals(ImmutableList.of("Alice", "Carol", "Dave", "Eve", "Frank"),
                graph.vertices().stream().map(Vertex::getName).toList());
        // Dave moved from 3 to 2, Frank from 5 to 4
        Assertions.assertEquals(ImmutableList.of(4), graph.neighborsOf(2));
        Assertions.assertEquals(ImmutableList.of(2, 3), graph.neighborsOf(4));
        assertConsistent(graph);
    }

    @Test
    void testRemoveVertexKeepsListOrder() throws GraphException {
        Graph graph = TestObjects.graphWith("A", "B", "C", "D");
        graph.insertEdge("D", "B");
        graph.insertEdge("D", "A");
        graph.insertEdge("D", "C");

        graph.removeVertex("A");

        // D (now 2) keeps C then B, renumbered to 1 and 0
        Assertions.assertEquals(ImmutableList.of(1, 0), graph.neighborsOf(2));
        Assertions.assertEquals(ImmutableList.of("C", "B"), graph.neighborNames(2));
        assertConsistent(graph);
    }

    @Test
    void testRemoveLastAndFirstVertex() throws GraphException {
        Graph graph = TestObjects.pathGraph("A", "B", "C", "D");
        graph.removeVertex(3);
        graph.removeVertex(0);
        Assertions.assertEquals(2, graph.size());
        Assertions.assertTrue(graph.hasEdge(0, 1));
        Assertions.assertEquals(ImmutableList.of(new Edge(0, 1)), graph.edges());
        assertConsistent(graph);

        graph.insertVertex("E");
        Assertions.assertFalse(graph.hasEdge(2, 0));
        Assertions.assertFalse(graph.hasEdge(1, 2));
        assertConsistent(graph);
    }

    @Test
    void testRemoveVertexErrors() throws GraphException {
        Graph graph = TestObjects.graphWith("A");
        Assertions.assertEquals(INVALID_INDEX,
                Assertions.assertThrows(GraphException.class, () -> graph.removeVertex(1)).getKind());
        Assertions.assertEquals(VERTEX_NOT_FOUND,
                Assertions.assertThrows(GraphException.class, () -> graph.removeVertex("B")).getKind());
        Assertions.assertEquals(1, graph.size());
    }

    @Test
    void testEdgesAreOrderedPairs() {
        Graph graph = TestObjects.sampleGraph();
        List<Edge> edges = graph.edges();
        Assertions.assertEquals(7, edges.size());
        Assertions.assertEquals(ImmutableList.of(
                new Edge(0, 1), new Edge(0, 2), new Edge(1, 2), new Edge(1, 3),
                new Edge(2, 4), new Edge(3, 5), new Edge(4, 5)), edges);
    }

    @Test
    void testIncidenceMatrix() throws GraphException {
        Graph graph = TestObjects.pathGraph("A", "B", "C");
        boolean[][] incidence = graph.incidenceMatrix();
        Assertions.assertArrayEquals(new boolean[][]{
                {true, false},
                {true, true},
                {false, true}}, incidence);
        Assertions.assertEquals(0, TestObjects.graphWith("A").incidenceMatrix()[0].length);
    }

    @Test
    void testClear() {
        Graph graph = TestObjects.sampleGraph();
        graph.clear();
        Assertions.assertTrue(graph.isEmpty());
        Assertions.assertEquals(0, graph.edgeCount());
        Assertions.assertEquals(6, SampleGraphs.loadFriendshipNetwork(graph));
        Assertions.assertEquals(7, graph.edgeCount());
        assertConsistent(graph);
    }

    @Test
    void testViewsAreSnapshots() throws GraphException {
        Graph graph = TestObjects.pathGraph("A", "B");
        boolean[][] matrix = graph.adjacencyMatrix();
        matrix[0][1] = false;
        Assertions.assertTrue(graph.hasEdge(0, 1));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> graph.vertices().clear());
    }
}
