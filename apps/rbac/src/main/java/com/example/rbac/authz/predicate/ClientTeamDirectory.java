package com.example.rbac.authz.predicate;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static mapping of client id to the teams that serve it.
 * Loaded once from {@code rbac.client-teams}; read-only afterwards.
 */
@Slf4j
public final class ClientTeamDirectory {

    private final Map<String, Set<String>> teamsByClient;

    private ClientTeamDirectory(Map<String, Set<String>> teamsByClient) {
        this.teamsByClient = teamsByClient;
    }

    public static ClientTeamDirectory fromConfig(Map<String, List<String>> entries) {
        Map<String, Set<String>> copy = new HashMap<>();
        entries.forEach((clientId, teams) -> {
            if (teams == null || teams.isEmpty()) {
                log.warn("Client {} has no serving teams; only managers will be able to read it", clientId);
                copy.put(clientId, Set.of());
            } else {
                copy.put(clientId, Set.copyOf(teams));
            }
        });
        return new ClientTeamDirectory(Collections.unmodifiableMap(copy));
    }

    /**
     * Teams serving the client, empty for an unknown client.
     */
    public Set<String> teamsFor(String clientId) {
        if (clientId == null) {
            return Set.of();
        }
        return teamsByClient.getOrDefault(clientId, Set.of());
    }

    public int size() {
        return teamsByClient.size();
    }
}
