package com.example.modelaudit.graph;

import com.example.modelaudit.model.CellRole;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An edge {@code A -> B} means the formula in B reads A.
 */
public class DependencyGraph {
    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private final Map<String, Set<String>> predecessors = new LinkedHashMap<>();
    private final Map<String, CellRole> roles = new LinkedHashMap<>();
    private int edgeCount;

    public void addNode(String node, CellRole role) {
        ensureNode(node);
        if (role != CellRole.LITERAL) {
            roles.put(node, role);
        }
    }

    public boolean addEdge(String source, String target) {
        ensureNode(source);
        ensureNode(target);
        if (!successors.get(source).add(target)) {
            return false;
        }
        predecessors.get(target).add(source);
        edgeCount++;
        return true;
    }

    private void ensureNode(String node) {
        if (node == null || node.isEmpty()) {
            throw new IllegalArgumentException("Node identity is required");
        }
        if (!roles.containsKey(node)) {
            roles.put(node, CellRole.LITERAL);
            successors.put(node, new LinkedHashSet<>());
            predecessors.put(node, new LinkedHashSet<>());
        }
    }

    public boolean contains(String node) {
        return roles.containsKey(node);
    }

    public boolean hasEdge(String source, String target) {
        Set<String> targets = successors.get(source);
        return targets != null && targets.contains(target);
    }

    public Set<String> nodes() {
        return Collections.unmodifiableSet(roles.keySet());
    }

    public Set<String> successors(String node) {
        Set<String> targets = successors.get(node);
        return targets == null ? Set.of() : Collections.unmodifiableSet(targets);
    }

    public Set<String> predecessors(String node) {
        Set<String> sources = predecessors.get(node);
        return sources == null ? Set.of() : Collections.unmodifiableSet(sources);
    }

    public int outDegree(String node) {
        return successors(node).size();
    }

    public int inDegree(String node) {
        return predecessors(node).size();
    }

    public CellRole role(String node) {
        return roles.get(node);
    }

    public List<String> nodesWithRole(CellRole role) {
        return roles.entrySet().stream()
                .filter(entry -> entry.getValue() == role)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public int nodeCount() {
        return roles.size();
    }

    public int edgeCount() {
        return edgeCount;
    }
}
