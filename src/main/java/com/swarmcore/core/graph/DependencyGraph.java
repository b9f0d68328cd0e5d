package com.swarmcore.core.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed acyclic graph of task dependencies.
 * <p>
 * Edges point from a task to the tasks it depends on. A task is ready once every
 * dependency is completed; readiness is recomputed incrementally, only for the direct
 * dependents of a task that just completed. Dependencies may reference tasks that have
 * not been added yet: such tasks are held as placeholders and block their dependents
 * until they are added and completed.
 * <p>
 * All public methods are synchronized; the graph is one consistency unit.
 */
public class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    /** Progress of a node as seen by the graph. */
    public enum NodeState {
        PENDING,
        READY,
        DISPATCHED,
        COMPLETED,
        FAILED,
        CANCELLED
    }

    private static final class Node {
        final String id;
        final Set<String> dependencies = new LinkedHashSet<>();
        final Set<String> dependents = new LinkedHashSet<>();
        NodeState state = NodeState.PENDING;
        boolean placeholder;

        Node(String id, boolean placeholder) {
            this.id = id;
            this.placeholder = placeholder;
        }
    }

    private final Map<String, Node> nodes = new LinkedHashMap<>();

    /**
     * Adds a task and its dependency edges.
     *
     * @throws CycleException           if the edges would close a cycle; nothing is committed
     * @throws IllegalArgumentException if the task already exists
     */
    public synchronized void addTask(String id, Collection<String> dependencies) {
        Node existing = nodes.get(id);
        if (existing != null && !existing.placeholder) {
            throw new IllegalArgumentException("Task already in graph: " + id);
        }
        var deps = new LinkedHashSet<>(dependencies);
        if (deps.contains(id)) {
            throw new CycleException(id, List.of(id, id));
        }
        // A cycle exists iff some dependency can already reach the new node.
        for (String dep : deps) {
            List<String> path = findPath(dep, id);
            if (path != null) {
                var cycle = new ArrayList<String>();
                cycle.add(id);
                cycle.addAll(path);
                throw new CycleException(id, cycle);
            }
        }

        Node node = existing != null ? existing : new Node(id, false);
        node.placeholder = false;
        nodes.put(id, node);
        for (String dep : deps) {
            Node depNode = nodes.computeIfAbsent(dep, d -> new Node(d, true));
            node.dependencies.add(dep);
            depNode.dependents.add(id);
        }
        refreshReadiness(node);
        log.debug("Added {} with dependencies {} (state={})", id, deps, node.state);
    }

    /**
     * Marks a task completed.
     *
     * @return dependents that became ready as a result
     */
    public synchronized Set<String> markCompleted(String id) {
        Node node = require(id);
        node.state = NodeState.COMPLETED;
        var newlyReady = new LinkedHashSet<String>();
        for (String dependentId : node.dependents) {
            Node dependent = nodes.get(dependentId);
            if (dependent != null && dependent.state == NodeState.PENDING) {
                refreshReadiness(dependent);
                if (dependent.state == NodeState.READY) {
                    newlyReady.add(dependentId);
                }
            }
        }
        return newlyReady;
    }

    /**
     * Marks a task as handed to the scheduler, removing it from the ready set.
     */
    public synchronized void markDispatched(String id) {
        Node node = require(id);
        if (node.state != NodeState.READY) {
            throw new IllegalStateException("Task " + id + " is " + node.state + ", not READY");
        }
        node.state = NodeState.DISPATCHED;
    }

    /**
     * Marks a task permanently failed. Its dependents never become ready.
     */
    public synchronized void markFailed(String id) {
        require(id).state = NodeState.FAILED;
    }

    /**
     * Cancels a task and every transitive dependent that has not completed.
     *
     * @return the cancelled ids, the given task first
     */
    public synchronized Set<String> markCancelled(String id) {
        Node node = require(id);
        var cancelled = new LinkedHashSet<String>();
        if (node.state != NodeState.COMPLETED) {
            node.state = NodeState.CANCELLED;
            cancelled.add(id);
        }
        cancelled.addAll(cascadeCancel(node));
        return cancelled;
    }

    /**
     * Cancels every transitive dependent of a task that can no longer complete, leaving
     * the task itself as it is.
     *
     * @return the cancelled ids
     */
    public synchronized Set<String> cancelDependents(String id) {
        return cascadeCancel(require(id));
    }

    /**
     * Current ready set. Does not change any state.
     */
    public synchronized Set<String> getReadyTasks() {
        var ready = new LinkedHashSet<String>();
        for (Node node : nodes.values()) {
            if (node.state == NodeState.READY) {
                ready.add(node.id);
            }
        }
        return ready;
    }

    public synchronized boolean isReady(String id) {
        Node node = nodes.get(id);
        return node != null && node.state == NodeState.READY;
    }

    /**
     * Removes a task.
     *
     * @param force when true, dependents are cascaded to CANCELLED instead of blocking removal
     * @return ids cancelled by the cascade (empty unless forced)
     * @throws HasDependentsException if dependents exist and {@code force} is false
     */
    public synchronized Set<String> removeTask(String id, boolean force) {
        Node node = require(id);
        Set<String> cancelled = Set.of();
        if (!node.dependents.isEmpty()) {
            if (!force) {
                throw new HasDependentsException(id, node.dependents);
            }
            cancelled = cascadeCancel(node);
            for (String dependentId : node.dependents) {
                Node dependent = nodes.get(dependentId);
                if (dependent != null) {
                    dependent.dependencies.remove(id);
                }
            }
        }
        for (String dep : node.dependencies) {
            Node depNode = nodes.get(dep);
            if (depNode != null) {
                depNode.dependents.remove(id);
                if (depNode.placeholder && depNode.dependents.isEmpty()) {
                    nodes.remove(dep);
                }
            }
        }
        nodes.remove(id);
        log.debug("Removed {} (cascade cancelled {})", id, cancelled);
        return cancelled;
    }

    public synchronized NodeState stateOf(String id) {
        return require(id).state;
    }

    public synchronized boolean contains(String id) {
        Node node = nodes.get(id);
        return node != null && !node.placeholder;
    }

    public synchronized Set<String> dependenciesOf(String id) {
        return Set.copyOf(require(id).dependencies);
    }

    public synchronized Set<String> dependentsOf(String id) {
        return Set.copyOf(require(id).dependents);
    }

    public synchronized int size() {
        return (int) nodes.values().stream().filter(n -> !n.placeholder).count();
    }

    /**
     * Length, in tasks, of the longest chain of dependents starting at the given task.
     * Computed on demand.
     */
    public synchronized int criticalPathLength(String id) {
        require(id);
        return longestChainFrom(id, new HashMap<>());
    }

    /**
     * The longest dependency chain in the graph, from a root to a terminal node.
     */
    public synchronized DependencyPath findCriticalPath() {
        var memo = new HashMap<String, Integer>();
        String best = null;
        int bestLength = 0;
        for (Node node : nodes.values()) {
            if (node.placeholder || !node.dependencies.isEmpty()) {
                continue;
            }
            int length = longestChainFrom(node.id, memo);
            if (length > bestLength) {
                bestLength = length;
                best = node.id;
            }
        }
        var path = new ArrayList<String>();
        String current = best;
        while (current != null) {
            path.add(current);
            String next = null;
            int nextLength = 0;
            for (String dependent : nodes.get(current).dependents) {
                int length = longestChainFrom(dependent, memo);
                if (length > nextLength) {
                    nextLength = length;
                    next = dependent;
                }
            }
            current = next;
        }
        return new DependencyPath(path);
    }

    /**
     * Kahn ordering of all real tasks; ties keep insertion order.
     */
    public synchronized List<String> topologicalOrder() {
        var inDegree = new LinkedHashMap<String, Integer>();
        for (Node node : nodes.values()) {
            if (!node.placeholder) {
                int degree = (int) node.dependencies.stream()
                        .filter(d -> !nodes.get(d).placeholder)
                        .count();
                inDegree.put(node.id, degree);
            }
        }
        var queue = new ArrayDeque<String>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });
        var order = new ArrayList<String>();
        while (!queue.isEmpty()) {
            String id = queue.poll();
            order.add(id);
            for (String dependent : nodes.get(id).dependents) {
                Integer degree = inDegree.computeIfPresent(dependent, (k, v) -> v - 1);
                if (degree != null && degree == 0) {
                    queue.add(dependent);
                }
            }
        }
        return order;
    }

    private Node require(String id) {
        Node node = nodes.get(id);
        if (node == null || node.placeholder) {
            throw new IllegalArgumentException("Unknown task: " + id);
        }
        return node;
    }

    private void refreshReadiness(Node node) {
        if (node.state != NodeState.PENDING && node.state != NodeState.READY) {
            return;
        }
        boolean satisfied = true;
        for (String dep : node.dependencies) {
            Node depNode = nodes.get(dep);
            if (depNode == null || depNode.placeholder || depNode.state != NodeState.COMPLETED) {
                satisfied = false;
                break;
            }
        }
        node.state = satisfied ? NodeState.READY : NodeState.PENDING;
    }

    private Set<String> cascadeCancel(Node root) {
        var cancelled = new LinkedHashSet<String>();
        var stack = new ArrayDeque<>(root.dependents);
        var seen = new HashSet<String>();
        while (!stack.isEmpty()) {
            String id = stack.pop();
            if (!seen.add(id)) {
                continue;
            }
            Node node = nodes.get(id);
            if (node == null || node.state == NodeState.COMPLETED) {
                continue;
            }
            if (node.state != NodeState.CANCELLED) {
                node.state = NodeState.CANCELLED;
                cancelled.add(id);
            }
            stack.addAll(node.dependents);
        }
        return cancelled;
    }

    /**
     * Depth-first search along dependency edges.
     *
     * @return the path from {@code from} to {@code target}, or null if unreachable
     */
    private List<String> findPath(String from, String target) {
        var stack = new ArrayDeque<List<String>>();
        stack.push(List.of(from));
        var visited = new HashSet<String>();
        while (!stack.isEmpty()) {
            List<String> path = stack.pop();
            String current = path.get(path.size() - 1);
            if (current.equals(target)) {
                return path;
            }
            if (!visited.add(current)) {
                continue;
            }
            Node node = nodes.get(current);
            if (node == null) {
                continue;
            }
            for (String dep : node.dependencies) {
                var next = new ArrayList<>(path);
                next.add(dep);
                stack.push(next);
            }
        }
        return null;
    }

    private int longestChainFrom(String id, Map<String, Integer> memo) {
        Integer cached = memo.get(id);
        if (cached != null) {
            return cached;
        }
        int longest = 0;
        for (String dependent : nodes.get(id).dependents) {
            longest = Math.max(longest, longestChainFrom(dependent, memo));
        }
        memo.put(id, longest + 1);
        return longest + 1;
    }
}
