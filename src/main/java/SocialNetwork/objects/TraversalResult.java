package SocialNetwork.objects;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Visit order produced by a traversal. {@link #getVisitedCount()} counts every
 * vertex reached, even when the reported order was truncated.
 */
public class TraversalResult {
    private static final TraversalResult EMPTY = new TraversalResult(ImmutableList.of(), 0);

    private final ImmutableList<Integer> order;
    private final int visitedCount;

    public TraversalResult(List<Integer> order, int visitedCount) {
        this.order = ImmutableList.copyOf(order);
        this.visitedCount = visitedCount;
    }

    public static TraversalResult empty() {
        return EMPTY;
    }

    public ImmutableList<Integer> getOrder() {
        return order;
    }

    public int getVisitedCount() {
        return visitedCount;
    }

    public boolean isEmpty() {
        return visitedCount == 0;
    }

    public boolean isTruncated() {
        return order.size() < visitedCount;
    }

    @Override
    public String toString() {
        return order + " (" + visitedCount + " visited)";
    }
}
