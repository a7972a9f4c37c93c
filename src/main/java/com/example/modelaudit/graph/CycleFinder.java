package com.example.modelaudit.graph;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Johnson's elementary cycle search over Tarjan components, on explicit stacks. Stops at
 * {@code maxCycles} or when the time budget runs out, and marks the result truncated.
 */
public class CycleFinder {
    private static final Logger LOGGER = LoggerFactory.getLogger(CycleFinder.class);
    private static final int DEADLINE_CHECK_INTERVAL = 1024;

    private final int maxCycles;
    private final Duration timeout;
    private final LongSupplier nanoClock;

    public CycleFinder(int maxCycles, Duration timeout) {
        this(maxCycles, timeout, System::nanoTime);
    }

    CycleFinder(int maxCycles, Duration timeout, LongSupplier nanoClock) {
        if (maxCycles <= 0) {
            throw new IllegalArgumentException("maxCycles must be positive: " + maxCycles);
        }
        this.maxCycles = maxCycles;
        this.timeout = timeout;
        this.nanoClock = nanoClock;
    }

    public CycleSearchResult find(DependencyGraph graph) {
        return find(graph, 0);
    }

    public CycleSearchResult find(DependencyGraph graph, int retainLimit) {
        Search search = new Search(retainLimit, nanoClock.getAsLong() + timeout.toNanos());

        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (String node : graph.nodes()) {
            Set<String> targets = new LinkedHashSet<>(graph.successors(node));
            if (targets.remove(node) && !search.record(List.of(node))) {
                return search.finish();
            }
            adjacency.put(node, targets);
        }

        Deque<Set<String>> pending = new ArrayDeque<>();
        for (Set<String> component : stronglyConnectedComponents(adjacency, adjacency.keySet())) {
            if (component.size() > 1) {
                pending.push(component);
            }
        }

        while (!pending.isEmpty()) {
            Set<String> component = pending.pop();
            String start = component.iterator().next();
            if (!circuitsFrom(start, component, adjacency, search)) {
                return search.finish();
            }
            component.remove(start);
            for (Set<String> rest : stronglyConnectedComponents(adjacency, component)) {
                if (rest.size() > 1) {
                    pending.push(rest);
                }
            }
        }
        return search.finish();
    }

    private boolean circuitsFrom(String start,
                                 Set<String> component,
                                 Map<String, Set<String>> adjacency,
                                 Search search) {
        List<String> path = new ArrayList<>();
        List<Boolean> closed = new ArrayList<>();
        Set<String> blocked = new HashSet<>();
        Map<String, Set<String>> blockedBy = new HashMap<>();
        Deque<Iterator<String>> stack = new ArrayDeque<>();

        path.add(start);
        closed.add(false);
        blocked.add(start);
        stack.push(adjacency.get(start).iterator());

        while (!stack.isEmpty()) {
            if (search.expired()) {
                return false;
            }
            Iterator<String> targets = stack.peek();
            boolean descended = false;
            while (targets.hasNext()) {
                String next = targets.next();
                if (!component.contains(next)) {
                    continue;
                }
                if (next.equals(start)) {
                    if (!search.record(new ArrayList<>(path))) {
                        return false;
                    }
                    closed.set(closed.size() - 1, true);
                } else if (!blocked.contains(next)) {
                    path.add(next);
                    closed.add(false);
                    blocked.add(next);
                    stack.push(adjacency.get(next).iterator());
                    descended = true;
                    break;
                }
            }
            if (descended) {
                continue;
            }

            stack.pop();
            String node = path.remove(path.size() - 1);
            boolean nodeClosed = closed.remove(closed.size() - 1);
            if (nodeClosed) {
                if (!closed.isEmpty()) {
                    closed.set(closed.size() - 1, true);
                }
                unblock(node, blocked, blockedBy);
            } else {
                for (String target : adjacency.get(node)) {
                    if (component.contains(target)) {
                        blockedBy.computeIfAbsent(target, key -> new HashSet<>()).add(node);
                    }
                }
            }
        }
        return true;
    }

    private void unblock(String node, Set<String> blocked, Map<String, Set<String>> blockedBy) {
        Deque<String> work = new ArrayDeque<>();
        work.push(node);
        while (!work.isEmpty()) {
            String current = work.pop();
            if (blocked.remove(current)) {
                Set<String> waiting = blockedBy.remove(current);
                if (waiting != null) {
                    waiting.forEach(work::push);
                }
            }
        }
    }

    static List<Set<String>> stronglyConnectedComponents(Map<String, Set<String>> adjacency, Set<String> nodes) {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        List<Set<String>> components = new ArrayList<>();
        int counter = 0;

        for (String root : nodes) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<Frame> work = new ArrayDeque<>();
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);
            work.push(new Frame(root, adjacency.get(root).iterator()));

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                boolean descended = false;
                while (frame.targets().hasNext()) {
                    String next = frame.targets().next();
                    if (!nodes.contains(next)) {
                        continue;
                    }
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        work.push(new Frame(next, adjacency.get(next).iterator()));
                        descended = true;
                        break;
                    }
                    if (onStack.contains(next)) {
                        lowLink.put(frame.node(), Math.min(lowLink.get(frame.node()), index.get(next)));
                    }
                }
                if (descended) {
                    continue;
                }

                work.pop();
                if (!work.isEmpty()) {
                    String parent = work.peek().node();
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.node())));
                }
                if (lowLink.get(frame.node()).equals(index.get(frame.node()))) {
                    Set<String> component = new LinkedHashSet<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.node()));
                    components.add(component);
                }
            }
        }
        return components;
    }

    private record Frame(String node, Iterator<String> targets) {
    }

    private final class Search {
        private final int retainLimit;
        private final long deadline;
        private final List<List<String>> retained = new ArrayList<>();
        private int count;
        private int steps;
        private boolean truncated;

        Search(int retainLimit, long deadline) {
            this.retainLimit = retainLimit;
            this.deadline = deadline;
        }

        boolean record(List<String> cycle) {
            if (count == maxCycles) {
                LOGGER.warn("Cycle enumeration stopped at the limit of {} cycles", maxCycles);
                truncated = true;
                return false;
            }
            count++;
            if (retained.size() < retainLimit) {
                retained.add(List.copyOf(cycle));
            }
            return true;
        }

        boolean expired() {
            if (++steps % DEADLINE_CHECK_INTERVAL != 0) {
                return false;
            }
            if (nanoClock.getAsLong() - deadline > 0) {
                LOGGER.warn("Cycle enumeration stopped after {} with {} cycle(s) found", timeout, count);
                truncated = true;
                return true;
            }
            return false;
        }

        CycleSearchResult finish() {
            return new CycleSearchResult(count, truncated, retained);
        }
    }
}
