package com.taskforest.core.index;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Compressed prefix tree over string keys. Each edge carries a label of one or more
 * characters; nodes with a single child and no value are merged away on insert.
 * <p>
 * All walks are iterative. Not thread-safe: an instance belongs to one pass.
 *
 * @param <V> value type stored at terminal nodes
 */
public class RadixTree<V> {

    private static final class Node<V> {
        String label;
        V value;
        boolean terminal;
        final TreeMap<Character, Node<V>> children = new TreeMap<>();

        Node(String label) {
            this.label = label;
        }
    }

    private Node<V> root = new Node<>("");
    private int size;
    private int nodeCount = 1;

    /**
     * Stores {@code value} under {@code key}.
     *
     * @return the value previously stored under the key, or null
     */
    public V put(String key, V value) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        Node<V> node = root;
        int i = 0;
        while (true) {
            if (i == key.length()) {
                V previous = node.value;
                if (!node.terminal) {
                    node.terminal = true;
                    size++;
                }
                node.value = value;
                return previous;
            }
            char c = key.charAt(i);
            Node<V> child = node.children.get(c);
            if (child == null) {
                Node<V> leaf = new Node<>(key.substring(i));
                leaf.terminal = true;
                leaf.value = value;
                node.children.put(c, leaf);
                size++;
                nodeCount++;
                return null;
            }
            String label = child.label;
            int common = commonLength(label, key, i);
            if (common == label.length()) {
                node = child;
                i += common;
                continue;
            }
            // split the edge at the divergence point
            Node<V> middle = new Node<>(label.substring(0, common));
            child.label = label.substring(common);
            middle.children.put(child.label.charAt(0), child);
            node.children.put(c, middle);
            nodeCount++;
            node = middle;
            i += common;
        }
    }

    public V get(String key) {
        Node<V> node = find(key);
        return node != null && node.terminal ? node.value : null;
    }

    public boolean containsKey(String key) {
        Node<V> node = find(key);
        return node != null && node.terminal;
    }

    /**
     * Stored keys that are prefixes of {@code query}, shortest first.
     */
    public List<String> prefixesOf(String query) {
        var keys = new ArrayList<String>();
        if (query == null) {
            return keys;
        }
        Node<V> node = root;
        int i = 0;
        if (node.terminal) {
            keys.add("");
        }
        while (i < query.length()) {
            Node<V> child = node.children.get(query.charAt(i));
            if (child == null || !query.startsWith(child.label, i)) {
                break;
            }
            i += child.label.length();
            node = child;
            if (node.terminal) {
                keys.add(query.substring(0, i));
            }
        }
        return keys;
    }

    public Optional<String> longestPrefixOf(String query) {
        List<String> prefixes = prefixesOf(query);
        return prefixes.isEmpty() ? Optional.empty() : Optional.of(prefixes.get(prefixes.size() - 1));
    }

    /**
     * Number of leading characters of {@code query} that can be followed down the tree,
     * including a partial match into an edge label.
     */
    public int sharedPrefixLength(String query) {
        if (query == null) {
            return 0;
        }
        Node<V> node = root;
        int i = 0;
        while (i < query.length()) {
            Node<V> child = node.children.get(query.charAt(i));
            if (child == null) {
                break;
            }
            int common = commonLength(child.label, query, i);
            i += common;
            if (common < child.label.length()) {
                break;
            }
            node = child;
        }
        return i;
    }

    /**
     * Stored keys starting with {@code prefix}, in lexicographic order, at most {@code limit}.
     */
    public List<String> keysWithPrefix(String prefix, int limit) {
        var keys = new ArrayList<String>();
        if (prefix == null || limit <= 0) {
            return keys;
        }
        Node<V> node = root;
        var path = new StringBuilder();
        int i = 0;
        while (i < prefix.length()) {
            Node<V> child = node.children.get(prefix.charAt(i));
            if (child == null) {
                return keys;
            }
            int remaining = prefix.length() - i;
            if (child.label.length() >= remaining) {
                if (!child.label.startsWith(prefix.substring(i))) {
                    return keys;
                }
            } else if (!prefix.startsWith(child.label, i)) {
                return keys;
            }
            path.append(child.label);
            i += child.label.length();
            node = child;
        }

        Deque<Node<V>> nodes = new ArrayDeque<>();
        Deque<String> paths = new ArrayDeque<>();
        nodes.push(node);
        paths.push(path.toString());
        while (!nodes.isEmpty() && keys.size() < limit) {
            Node<V> current = nodes.pop();
            String currentPath = paths.pop();
            if (current.terminal) {
                keys.add(currentPath);
            }
            for (Node<V> child : current.children.descendingMap().values()) {
                nodes.push(child);
                paths.push(currentPath + child.label);
            }
        }
        return keys;
    }

    public int size() {
        return size;
    }

    /** Node count including the root. */
    public int nodeCount() {
        return nodeCount;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void clear() {
        root = new Node<>("");
        size = 0;
        nodeCount = 1;
    }

    private Node<V> find(String key) {
        if (key == null) {
            return null;
        }
        Node<V> node = root;
        int i = 0;
        while (i < key.length()) {
            Node<V> child = node.children.get(key.charAt(i));
            if (child == null || !key.startsWith(child.label, i)) {
                return null;
            }
            i += child.label.length();
            node = child;
        }
        return node;
    }

    private static int commonLength(String label, String key, int offset) {
        int n = Math.min(label.length(), key.length() - offset);
        int j = 0;
        while (j < n && label.charAt(j) == key.charAt(offset + j)) {
            j++;
        }
        return j;
    }
}
