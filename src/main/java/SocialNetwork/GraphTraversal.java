package SocialNetwork;

import SocialNetwork.objects.Graph;
import SocialNetwork.objects.TraversalResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Queue;

/**
 * Breadth-first and depth-first traversals over a {@link Graph}. Neighbors are
 * explored in adjacency-list order, i.e. most recent friendship first. Neither
 * traversal modifies the graph.
 */
public class GraphTraversal {

    public static TraversalResult bfs(Graph graph, int start) {
        return bfs(graph, start, Integer.MAX_VALUE);
    }

    /**
     * Breadth-first traversal from {@code start}. A vertex is marked visited when
     * it is enqueued, so it can never be queued twice.
     *
     * @param graph     Graph to traverse.
     * @param start     Index of the starting vertex.
     * @param maxOut    Maximum number of indices reported in the visit order.
     * @return          The visit order (at most {@code maxOut} entries) and the number
     *                  of vertices reached. Empty if {@code start} is out of range.
     */
    public static TraversalResult bfs(Graph graph, int start, int maxOut) {
        if (!graph.isValidIndex(start)) {
            return TraversalResult.empty();
        }
        boolean[] visited = new boolean[graph.size()];
        Queue<Integer> queue = new ArrayDeque<>();
        List<Integer> order = new ArrayList<>();
        int count = 0;

        visited[start] = true;
        queue.add(start);
        while (!queue.isEmpty()) {
            int u = queue.poll();
            if (count < maxOut) order.add(u);
            count++;
            for (int v : graph.neighborsOf(u)) {
                if (!visited[v]) {
                    visited[v] = true;
                    queue.add(v);
                }
            }
        }
        return new TraversalResult(order, count);
    }

    /**
     * Depth-first traversal from {@code start}, in the same order as the recursive
     * formulation. An explicit stack of neighbor iterators replaces the call stack.
     *
     * @return  The visit order, or an empty result if {@code start} is out of range.
     */
    public static TraversalResult dfs(Graph graph, int start) {
        if (!graph.isValidIndex(start)) {
            return TraversalResult.empty();
        }
        boolean[] visited = new boolean[graph.size()];
        List<Integer> order = new ArrayList<>();
        Deque<Iterator<Integer>> stack = new ArrayDeque<>();

        visited[start] = true;
        order.add(start);
        stack.push(graph.neighborsOf(start).iterator());
        while (!stack.isEmpty()) {
            Iterator<Integer> neighbors = stack.peek();
            if (!neighbors.hasNext()) {
                stack.pop();
                continue;
            }
            int v = neighbors.next();
            if (!visited[v]) {
                visited[v] = true;
                order.add(v);
                stack.push(graph.neighborsOf(v).iterator());
            }
        }
        return new TraversalResult(order, order.size());
    }
}
