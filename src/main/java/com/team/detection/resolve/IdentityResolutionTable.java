package com.team.detection.resolve;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Alias to numeric identifier mapping for one run.
 *
 * Bindings are write-once: the source's alias for a numeric identifier is assumed not to change
 * while a run is in progress, so the first recorded binding wins and nothing is ever removed.
 * Profiles known to have no alias are tracked separately so that "no alias" is distinguishable
 * from "not resolved yet".
 */
public class IdentityResolutionTable {

    private final Map<String, String> aliasToNumeric = new ConcurrentHashMap<>();
    private final Map<String, String> numericToAlias = new ConcurrentHashMap<>();
    private final Set<String> withoutAlias = ConcurrentHashMap.newKeySet();

    /**
     * Records an alias binding. An empty alias records that the profile has none.
     */
    public void record(String aliasId, String numericId) {
        if (aliasId == null || aliasId.isEmpty()) {
            recordNoAlias(numericId);
            return;
        }
        aliasToNumeric.putIfAbsent(aliasId, numericId);
        numericToAlias.putIfAbsent(numericId, aliasId);
    }

    public void recordNoAlias(String numericId) {
        if (!numericToAlias.containsKey(numericId)) {
            withoutAlias.add(numericId);
        }
    }

    public Optional<String> numericFor(String aliasId) {
        return Optional.ofNullable(aliasToNumeric.get(aliasId));
    }

    /**
     * Returns the alias for a numeric identifier: the alias itself, an empty string if the profile is
     * known to have none, or empty if it has not been resolved yet.
     */
    public Optional<String> aliasFor(String numericId) {
        String alias = numericToAlias.get(numericId);
        if (alias != null) {
            return Optional.of(alias);
        }
        return withoutAlias.contains(numericId) ? Optional.of("") : Optional.empty();
    }

    public int size() {
        return aliasToNumeric.size();
    }
}
