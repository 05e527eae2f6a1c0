package com.nodeproxy.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the daemon's service node registry (get_service_nodes / get_all_service_nodes).
 */
public record ServiceNodeEntry(
        String serviceNodePubkey,
        long registrationHeight,
        long requestedUnlockHeight,
        long lastRewardBlockHeight,
        long lastUptimeProof,
        boolean active,
        boolean funded,
        long stakingRequirement,
        long totalContributed,
        long portionsForOperator,
        String operatorAddress,
        List<Contributor> contributors
) {

    public ServiceNodeEntry {
        contributors = contributors != null ? List.copyOf(contributors) : List.of();
    }

    /**
     * Stake contributed to a service node by one address.
     */
    public record Contributor(String address, long amount, long reserved) {
    }

    /**
     * Builds an entry from one element of {@code service_node_states}. Missing fields default to 0 / false / null.
     */
    public static ServiceNodeEntry fromJson(JsonNode node) {
        List<Contributor> contributors = new ArrayList<>();
        for (JsonNode c : node.path("contributors")) {
            contributors.add(new Contributor(
                    c.path("address").asText(null),
                    c.path("amount").asLong(),
                    c.path("reserved").asLong()));
        }
        return new ServiceNodeEntry(
                node.path("service_node_pubkey").asText(null),
                node.path("registration_height").asLong(),
                node.path("requested_unlock_height").asLong(),
                node.path("last_reward_block_height").asLong(),
                node.path("last_uptime_proof").asLong(),
                node.path("active").asBoolean(false),
                node.path("funded").asBoolean(false),
                node.path("staking_requirement").asLong(),
                node.path("total_contributed").asLong(),
                node.path("portions_for_operator").asLong(),
                node.path("operator_address").asText(null),
                contributors);
    }

    /**
     * Parses the {@code service_node_states} array of a registry response; absent array yields an empty list.
     */
    public static List<ServiceNodeEntry> listFromResult(JsonNode result) {
        JsonNode states = result.path("service_node_states");
        if (!states.isArray()) {
            return List.of();
        }
        List<ServiceNodeEntry> entries = new ArrayList<>(states.size());
        for (JsonNode state : states) {
            entries.add(fromJson(state));
        }
        return List.copyOf(entries);
    }
}
