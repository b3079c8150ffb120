package org.lexidex.core.index;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Prefix tree over the index vocabulary, used for autocomplete.
 *
 * <p>Nodes live in an arena and are addressed by integer handles; {@link #ROOT} is handle {@code 0}. Each node maps a
 * code point to a child handle and may mark a complete term carrying a weight (its total corpus frequency).
 * Suggestion cost depends on the prefix length and the number of terms below it, not on the vocabulary size.</p>
 */
public final class PrefixTrie {
    public static final int ROOT = 0;

    private static final Comparator<Suggestion> SUGGESTION_ORDER =
            Comparator.comparingLong(Suggestion::weight).reversed().thenComparing(Suggestion::term);

    private final List<Map<Integer, Integer>> children;
    private final String[] terms;
    private final long[] weights;
    private final int size;

    private PrefixTrie(List<Map<Integer, Integer>> children, String[] terms, long[] weights) {
        this.children = children;
        this.terms = terms;
        this.weights = weights;
        int count = 0;
        for (String term : terms) {
            if (term != null) {
                count++;
            }
        }
        this.size = count;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A term and its weight, as returned by {@link #suggestWithWeights(String, int)}.
     */
    public record Suggestion(String term, long weight) {}

    /**
     * Arena node as exported for persistence. {@code children} maps code points to node handles.
     */
    public record Node(Map<Integer, Integer> children, boolean terminal, long weight) {}

    /**
     * Up to {@code limit} complete terms starting with {@code prefix}, by descending weight then lexicographically.
     * An unknown prefix, a null prefix or a non-positive limit gives an empty list.
     */
    public List<String> suggest(String prefix, int limit) {
        List<Suggestion> suggestions = suggestWithWeights(prefix, limit);
        List<String> result = new ArrayList<>(suggestions.size());
        for (Suggestion suggestion : suggestions) {
            result.add(suggestion.term());
        }
        return result;
    }

    public List<Suggestion> suggestWithWeights(String prefix, int limit) {
        if (prefix == null || limit <= 0) {
            return List.of();
        }
        int start = find(prefix);
        if (start < 0) {
            return List.of();
        }

        List<Suggestion> matches = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            int node = stack.pop();
            if (terms[node] != null) {
                matches.add(new Suggestion(terms[node], weights[node]));
            }
            for (int child : children.get(node).values()) {
                stack.push(child);
            }
        }

        matches.sort(SUGGESTION_ORDER);
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : List.copyOf(matches);
    }

    public boolean contains(String term) {
        int node = term == null ? -1 : find(term);
        return node >= 0 && terms[node] != null;
    }

    /**
     * @return weight of a complete term, or {@code -1} if the term is not in the trie
     */
    public long weight(String term) {
        int node = term == null ? -1 : find(term);
        return node >= 0 && terms[node] != null ? weights[node] : -1;
    }

    /** All complete terms, sorted. */
    public SortedSet<String> terms() {
        SortedSet<String> result = new TreeSet<>();
        for (String term : terms) {
            if (term != null) {
                result.add(term);
            }
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /** Number of complete terms. */
    public int size() {
        return size;
    }

    public int nodeCount() {
        return children.size();
    }

    /**
     * Exports the arena; list index is the node handle.
     */
    public List<Node> nodes() {
        List<Node> nodes = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            nodes.add(new Node(children.get(i), terms[i] != null, terms[i] != null ? weights[i] : 0L));
        }
        return nodes;
    }

    /**
     * Rebuilds a trie from an exported arena. The arena must form a tree rooted at handle {@code 0}: every handle in
     * range, every node except the root reached exactly once, and no non-terminal leaves.
     *
     * @throws IllegalArgumentException if the arena is not a valid trie
     */
    public static PrefixTrie fromNodes(List<Node> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("Trie arena has no root node");
        }
        int count = nodes.size();
        List<Map<Integer, Integer>> children = new ArrayList<>(Collections.nCopies(count, null));
        String[] terms = new String[count];
        long[] weights = new long[count];
        String[] paths = new String[count];
        paths[ROOT] = "";

        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(ROOT);
        int visited = 0;
        while (!queue.isEmpty()) {
            int handle = queue.poll();
            visited++;
            Node node = nodes.get(handle);
            if (node == null) {
                throw new IllegalArgumentException("Missing trie node " + handle);
            }
            Map<Integer, Integer> nodeChildren = node.children() == null ? Map.of() : node.children();

            SortedMap<Integer, Integer> copy = new TreeMap<>();
            for (Map.Entry<Integer, Integer> edge : nodeChildren.entrySet()) {
                Integer codePoint = edge.getKey();
                Integer child = edge.getValue();
                if (codePoint == null || !Character.isValidCodePoint(codePoint)) {
                    throw new IllegalArgumentException("Invalid code point on edge from node " + handle);
                }
                if (child == null || child <= ROOT || child >= count) {
                    throw new IllegalArgumentException("Child handle out of range at node " + handle + ": " + child);
                }
                if (paths[child] != null) {
                    throw new IllegalArgumentException("Node " + child + " is reached more than once");
                }
                paths[child] = paths[handle] + new String(Character.toChars(codePoint));
                copy.put(codePoint, child);
                queue.add(child);
            }

            if (node.terminal()) {
                if (handle == ROOT) {
                    throw new IllegalArgumentException("Root node cannot hold a term");
                }
                if (node.weight() < 0) {
                    throw new IllegalArgumentException("Negative weight at node " + handle);
                }
                terms[handle] = paths[handle];
                weights[handle] = node.weight();
            } else if (copy.isEmpty() && handle != ROOT) {
                throw new IllegalArgumentException("Node " + handle + " is a leaf without a term");
            }
            children.set(handle, Collections.unmodifiableSortedMap(copy));
        }

        if (visited != count) {
            throw new IllegalArgumentException("Trie arena has " + (count - visited) + " unreachable nodes");
        }
        return new PrefixTrie(List.copyOf(children), terms, weights);
    }

    private int find(String prefix) {
        int node = ROOT;
        int offset = 0;
        while (offset < prefix.length()) {
            int codePoint = prefix.codePointAt(offset);
            Integer next = children.get(node).get(codePoint);
            if (next == null) {
                return -1;
            }
            node = next;
            offset += Character.charCount(codePoint);
        }
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PrefixTrie other)) {
            return false;
        }
        return children.equals(other.children)
                && Arrays.equals(terms, other.terms)
                && Arrays.equals(weights, other.weights);
    }

    @Override
    public int hashCode() {
        return Objects.hash(children, Arrays.hashCode(terms), Arrays.hashCode(weights));
    }

    @Override
    public String toString() {
        return "PrefixTrie{terms=" + size + ", nodes=" + children.size() + "}";
    }

    /**
     * Grows the arena one term at a time. Inserting a term again keeps the larger weight.
     */
    public static final class Builder {
        private final List<SortedMap<Integer, Integer>> children = new ArrayList<>();
        private final List<String> terms = new ArrayList<>();
        private final List<Long> weights = new ArrayList<>();

        private Builder() {
            newNode();
        }

        public Builder insert(String term, long weight) {
            if (term == null || term.isEmpty()) {
                throw new IllegalArgumentException("Cannot insert an empty term");
            }
            if (weight < 0) {
                throw new IllegalArgumentException("Weight must be non-negative: " + weight);
            }
            int node = ROOT;
            int offset = 0;
            while (offset < term.length()) {
                int codePoint = term.codePointAt(offset);
                Integer next = children.get(node).get(codePoint);
                if (next == null) {
                    next = newNode();
                    children.get(node).put(codePoint, next);
                }
                node = next;
                offset += Character.charCount(codePoint);
            }
            if (terms.get(node) == null) {
                terms.set(node, term);
                weights.set(node, weight);
            } else {
                weights.set(node, Math.max(weights.get(node), weight));
            }
            return this;
        }

        public PrefixTrie build() {
            int count = children.size();
            List<Map<Integer, Integer>> frozen = new ArrayList<>(count);
            long[] weightArray = new long[count];
            for (int i = 0; i < count; i++) {
                frozen.add(Collections.unmodifiableSortedMap(new TreeMap<>(children.get(i))));
                weightArray[i] = weights.get(i);
            }
            return new PrefixTrie(List.copyOf(frozen), terms.toArray(new String[0]), weightArray);
        }

        private int newNode() {
            children.add(new TreeMap<>());
            terms.add(null);
            weights.add(0L);
            return children.size() - 1;
        }
    }
}
