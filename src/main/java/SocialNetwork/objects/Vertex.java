package SocialNetwork.objects;

import com.google.common.collect.ImmutableList;

import java.util.LinkedList;

/**
 * A person in the network. The adjacency list holds neighbor indices with the
 * most recently added friendship first.
 */
public class Vertex {
    private final String name;
    private final LinkedList<Integer> neighbors;

    Vertex(String name) {
        this.name = name;
        this.neighbors = new LinkedList<>();
    }

    public String getName() {
        return name;
    }

    /**
     * @return  A snapshot of the neighbor indices, in adjacency-list order.
     */
    public ImmutableList<Integer> getNeighbors() {
        return ImmutableList.copyOf(neighbors);
    }

    public int degree() {
        return neighbors.size();
    }

    LinkedList<Integer> adjacency() {
        return neighbors;
    }

    @Override
    public String toString() {
        return name;
    }
}
