package com.danieljhkim.meshcoord.meshcoordinator.health;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Connected components of the mutual-reachability graph: an edge exists only when each node reports the other as
 * reachable.
 */
public final class ConnectedComponents {

    private ConnectedComponents() {}

    /**
     * Breadth-first search in {@code nodes} order. Components, and the members inside each, keep that order.
     */
    public static List<Set<NodeId>> compute(List<NodeId> nodes, Map<NodeId, Set<NodeId>> reachability) {
        Set<NodeId> candidates = new LinkedHashSet<>(nodes);
        Set<NodeId> visited = new HashSet<>();
        List<Set<NodeId>> components = new ArrayList<>();

        for (NodeId start : candidates) {
            if (!visited.add(start)) {
                continue;
            }
            Set<NodeId> component = new LinkedHashSet<>();
            Deque<NodeId> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                NodeId current = queue.poll();
                component.add(current);
                for (NodeId neighbor : candidates) {
                    if (!visited.contains(neighbor) && mutuallyReachable(current, neighbor, reachability)) {
                        visited.add(neighbor);
                        queue.add(neighbor);
                    }
                }
            }
            components.add(component);
        }
        return components;
    }

    static boolean mutuallyReachable(NodeId a, NodeId b, Map<NodeId, Set<NodeId>> reachability) {
        Set<NodeId> fromA = reachability.getOrDefault(a, Set.of());
        Set<NodeId> fromB = reachability.getOrDefault(b, Set.of());
        return fromA.contains(b) && fromB.contains(a);
    }
}
