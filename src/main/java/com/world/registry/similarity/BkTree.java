package com.world.registry.similarity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Burkhard-Keller tree over a fixed set of keys for bounded-distance lookups.
 *
 * <p>Replaces a linear scan over every index key: a search with radius {@code r} only
 * descends into children whose edge distance lies in {@code [d - r, d + r]}. Immutable
 * after construction and safe for concurrent searches.</p>
 */
public final class BkTree {

    private final DistanceMetric metric;
    private final Node root;
    private final int size;

    private BkTree(DistanceMetric metric, Node root, int size) {
        this.metric = metric;
        this.root = root;
        this.size = size;
    }

    /**
     * Builds a tree from the given keys. Duplicate keys are stored once.
     */
    public static BkTree build(Collection<String> keys, DistanceMetric metric) {
        Objects.requireNonNull(metric, "metric is required");
        Node root = null;
        int size = 0;
        for (String key : keys) {
            if (root == null) {
                root = new Node(key);
                size++;
                continue;
            }
            if (insert(root, key, metric)) {
                size++;
            }
        }
        return new BkTree(metric, root, size);
    }

    private static boolean insert(Node root, String key, DistanceMetric metric) {
        Node node = root;
        while (true) {
            int d = metric.distance(key, node.key);
            if (d == 0) {
                return false;
            }
            Node child = node.children.get(d);
            if (child == null) {
                node.children.put(d, new Node(key));
                return true;
            }
            node = child;
        }
    }

    /**
     * Returns every key within {@code radius} of the query, in no particular order.
     */
    public List<Match> search(String query, int radius) {
        Objects.requireNonNull(query, "query is required");
        if (radius < 0) {
            throw new IllegalArgumentException("radius must be >= 0");
        }
        List<Match> matches = new ArrayList<>();
        if (root == null) {
            return matches;
        }
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            int d = metric.distance(query, node.key);
            if (d <= radius) {
                matches.add(new Match(node.key, d));
            }
            for (Map.Entry<Integer, Node> child : node.children.entrySet()) {
                int edge = child.getKey();
                if (edge >= d - radius && edge <= d + radius) {
                    pending.push(child.getValue());
                }
            }
        }
        return matches;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * A key found by {@link #search(String, int)} and its distance from the query.
     */
    public record Match(String key, int distance) {
    }

    private static final class Node {
        private final String key;
        private final Map<Integer, Node> children = new HashMap<>();

        Node(String key) {
            this.key = key;
        }
    }
}
