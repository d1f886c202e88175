package com.danieljhkim.meshcoord.meshcoordinator.health;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Networking collaborator that reports pairwise reachability.
 */
@FunctionalInterface
public interface ReachabilityProbe {

    /**
     * @param candidates nodes to probe
     * @return for each candidate, the candidates it can currently reach; missing entries mean "reaches nobody"
     * @throws com.danieljhkim.meshcoord.meshcommon.exception.NetworkException if probing is impossible right now
     */
    Map<NodeId, Set<NodeId>> probe(List<NodeId> candidates);

    /**
     * Probe for a fully connected mesh, used when no networking collaborator is configured.
     */
    static ReachabilityProbe fullyConnected() {
        return candidates -> {
            Set<NodeId> all = Set.copyOf(candidates);
            Map<NodeId, Set<NodeId>> result = new HashMap<>();
            for (NodeId node : candidates) {
                result.put(node, all);
            }
            return result;
        };
    }
}
