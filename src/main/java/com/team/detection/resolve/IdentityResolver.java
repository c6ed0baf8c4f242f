package com.team.detection.resolve;

import com.team.detection.cache.FetchCache;
import com.team.detection.core.model.ProfileDetails;
import com.team.detection.core.model.ProfileIdentity;
import com.team.detection.core.model.RelationshipRecord;
import com.team.detection.extract.ExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Translates between the two addressing schemes of a profile.
 *
 * Both directions consult the {@link IdentityResolutionTable} first and fall back to fetching the
 * profile through the {@link FetchCache}, which records the binding as a side effect.
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final FetchCache fetchCache;
    private final IdentityResolutionTable table;

    public IdentityResolver(FetchCache fetchCache, IdentityResolutionTable table) {
        this.fetchCache = Objects.requireNonNull(fetchCache, "fetchCache is required");
        this.table = Objects.requireNonNull(table, "table is required");
    }

    /**
     * Resolves an alias to its numeric identifier.
     *
     * @throws ExtractionException if the profile page carries no numeric identifier
     */
    public String resolveNumeric(String aliasId) {
        Optional<String> known = table.numericFor(aliasId);
        if (known.isPresent()) {
            log.debug("resolve.numeric alias={} numericId={} cached=true", aliasId, known.get());
            return known.get();
        }

        fetchCache.getProfileDetailsByAlias(aliasId);
        String numericId = table.numericFor(aliasId)
                .orElseThrow(() -> new ExtractionException("numericId",
                        "Could not resolve numeric identifier for alias '" + aliasId + "'"));
        log.debug("resolve.numeric alias={} numericId={} cached=false", aliasId, numericId);
        return numericId;
    }

    /**
     * Resolves a numeric identifier to its alias.
     *
     * @return the alias, or an empty string if the profile has none
     */
    public String resolveAlias(String numericId) {
        Optional<String> known = table.aliasFor(numericId);
        if (known.isPresent()) {
            return known.get();
        }

        fetchCache.getProfileDetails(numericId);
        String alias = table.aliasFor(numericId).orElse("");
        log.debug("resolve.alias numericId={} alias='{}'", numericId, alias);
        return alias;
    }

    /**
     * Returns the details of a profile, fetching its page on first use.
     */
    public ProfileDetails details(String numericId) {
        return fetchCache.getProfileDetails(numericId);
    }

    /**
     * Returns the identity with its numeric identifier filled in, resolving the alias if needed.
     */
    public ProfileIdentity withNumericId(ProfileIdentity identity) {
        if (identity.getNumericId().isPresent()) {
            return identity;
        }
        String alias = identity.knownAlias()
                .orElseThrow(() -> new IllegalArgumentException("identity has no identifier: " + identity));
        return identity.withNumericId(resolveNumeric(alias));
    }

    /**
     * Returns the numeric identifier of an identity without touching the network.
     */
    Optional<String> knownNumericId(ProfileIdentity identity) {
        if (identity.getNumericId().isPresent()) {
            return identity.getNumericId();
        }
        return identity.knownAlias().flatMap(table::numericFor);
    }

    /**
     * Records every alias binding visible in the given records.
     */
    public void learn(Collection<RelationshipRecord> records) {
        for (RelationshipRecord record : records) {
            ProfileIdentity identity = record.identity();
            if (identity.getNumericId().isPresent() && identity.knownAlias().isPresent()) {
                table.record(identity.knownAlias().get(), identity.getNumericId().get());
            }
        }
    }
}
