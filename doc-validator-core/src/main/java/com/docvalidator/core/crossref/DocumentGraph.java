package com.docvalidator.core.crossref;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Directed file-to-file link graph of a corpus.
 *
 * <p>Nodes are file paths in corpus order; an edge {@code a -> b} exists when {@code a} holds at
 * least one resolved link to {@code b}. Links from a file to itself are not edges.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DocumentGraph graph = report.graph();
 * List<String> orphans = graph.orphans();
 * List<List<String>> cycles = graph.cycles();
 * }</pre>
 */
public final class DocumentGraph {

    private final List<String> nodes;
    private final Map<String, Set<String>> outgoing;
    private final Map<String, Set<String>> incoming;

    private DocumentGraph(List<String> nodes, Map<String, Set<String>> outgoing) {
        this.nodes = List.copyOf(nodes);
        Map<String, Set<String>> out = new LinkedHashMap<>();
        Map<String, Set<String>> in = new LinkedHashMap<>();
        for (String node : this.nodes) {
            out.put(node, new LinkedHashSet<>());
            in.put(node, new LinkedHashSet<>());
        }
        // Edge sets are filled in node order so incoming sets stay deterministic
        for (String from : this.nodes) {
            for (String to : outgoing.getOrDefault(from, Set.of())) {
                out.get(from).add(to);
                in.get(to).add(from);
            }
        }
        this.outgoing = freeze(out);
        this.incoming = freeze(in);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> nodes() {
        return nodes;
    }

    public Set<String> outgoing(String node) {
        return outgoing.getOrDefault(node, Set.of());
    }

    public Set<String> incoming(String node) {
        return incoming.getOrDefault(node, Set.of());
    }

    public int edgeCount() {
        return outgoing.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * Returns files no other file links to, in corpus order.
     *
     * @return orphan file paths
     */
    public List<String> orphans() {
        return nodes.stream()
            .filter(node -> incoming(node).isEmpty())
            .toList();
    }

    /**
     * Finds link cycles as strongly connected components with more than one file.
     *
     * <p>Each cycle is listed in corpus order; cycles are ordered by their first file.</p>
     *
     * @return cycles, empty if the graph is acyclic
     */
    public List<List<String>> cycles() {
        Tarjan tarjan = new Tarjan();
        for (String node : nodes) {
            if (!tarjan.index.containsKey(node)) {
                tarjan.strongConnect(node);
            }
        }

        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            position.put(nodes.get(i), i);
        }
        List<List<String>> cycles = new ArrayList<>();
        for (List<String> component : tarjan.components) {
            if (component.size() > 1) {
                List<String> sorted = new ArrayList<>(component);
                sorted.sort((a, b) -> Integer.compare(position.get(a), position.get(b)));
                cycles.add(List.copyOf(sorted));
            }
        }
        cycles.sort((a, b) -> Integer.compare(position.get(a.get(0)), position.get(b.get(0))));
        return List.copyOf(cycles);
    }

    public boolean hasCycles() {
        return !cycles().isEmpty();
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> map) {
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        map.forEach((key, value) -> frozen.put(key, Collections.unmodifiableSet(value)));
        return Collections.unmodifiableMap(frozen);
    }

    private final class Tarjan {
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new LinkedHashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter;

        private void strongConnect(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (String next : outgoing(node)) {
                if (!index.containsKey(next)) {
                    strongConnect(next);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                List<String> component = new ArrayList<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));
                components.add(component);
            }
        }
    }

    /**
     * Collects nodes and edges while the validator walks the corpus.
     */
    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Set<String>> edges = new HashMap<>();

        private Builder() {
        }

        public Builder addNode(String node) {
            Objects.requireNonNull(node, "node must not be null");
            if (!edges.containsKey(node)) {
                nodes.add(node);
                edges.put(node, new LinkedHashSet<>());
            }
            return this;
        }

        /**
         * Adds an edge; both ends must already be nodes and self-edges are ignored.
         */
        public Builder addEdge(String from, String to) {
            if (from.equals(to)) {
                return this;
            }
            if (!edges.containsKey(from) || !edges.containsKey(to)) {
                throw new IllegalArgumentException("Unknown node in edge " + from + " -> " + to);
            }
            edges.get(from).add(to);
            return this;
        }

        public DocumentGraph build() {
            return new DocumentGraph(nodes, edges);
        }
    }
}
