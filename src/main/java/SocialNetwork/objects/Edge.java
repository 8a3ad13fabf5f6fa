package SocialNetwork.objects;

import SocialNetwork.util.GraphUtil;

import java.util.Objects;

/**
 * An undirected friendship between two vertex indices, stored with {@code u < v}.
 */
public final class Edge {
    private final int u;
    private final int v;

    public Edge(int a, int b) {
        this.u = Math.min(a, b);
        this.v = Math.max(a, b);
    }

    public int getU() {
        return u;
    }

    public int getV() {
        return v;
    }

    public boolean touches(int index) {
        return u == index || v == index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge other = (Edge) o;
        return u == other.u && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(u, v);
    }

    @Override
    public String toString() {
        return GraphUtil.edgeLabel(u, v);
    }
}
