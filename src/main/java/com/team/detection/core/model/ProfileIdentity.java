package com.team.detection.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable identity of a profile on the relationship source.
 *
 * A profile can be addressed by two schemes: a permanent numeric identifier and an optional,
 * user-chosen alias. Either may be unknown when the identity is first encountered, but at least
 * one of them is always present.
 *
 * <p>The alias has three states:</p>
 * <ul>
 *   <li>{@code Optional.empty()} - not resolved yet</li>
 *   <li>{@code Optional.of("")} - resolved, the profile has no alias</li>
 *   <li>{@code Optional.of("name")} - resolved alias</li>
 * </ul>
 *
 * {@link #equals(Object)} is plain value equality. Use {@link #sameIdentityAs(ProfileIdentity)}
 * to decide whether two identities denote the same profile; display names never take part in that decision.
 */
public final class ProfileIdentity {

    private final String numericId;
    private final String aliasId;
    private final String displayName;

    private ProfileIdentity(String numericId, String aliasId, String displayName) {
        if (numericId == null && (aliasId == null || aliasId.isEmpty())) {
            throw new IllegalArgumentException("numericId or aliasId is required");
        }
        this.numericId = numericId;
        this.aliasId = aliasId;
        this.displayName = Objects.requireNonNull(displayName, "displayName is required");
    }

    /**
     * Creates an identity known only by its numeric identifier.
     */
    public static ProfileIdentity ofNumeric(String numericId, String displayName) {
        return new ProfileIdentity(Objects.requireNonNull(numericId, "numericId is required"), null, displayName);
    }

    /**
     * Creates an identity known only by its alias.
     */
    public static ProfileIdentity ofAlias(String aliasId, String displayName) {
        return new ProfileIdentity(null, Objects.requireNonNull(aliasId, "aliasId is required"), displayName);
    }

    /**
     * Creates an identity with both identifiers resolved. An empty alias records "no alias".
     */
    public static ProfileIdentity resolved(String numericId, String aliasId, String displayName) {
        return new ProfileIdentity(
                Objects.requireNonNull(numericId, "numericId is required"),
                Objects.requireNonNull(aliasId, "aliasId is required"),
                displayName);
    }

    /**
     * Creates an identity from optional identifiers, as read from a relationship listing.
     */
    public static ProfileIdentity of(String numericId, String aliasId, String displayName) {
        return new ProfileIdentity(numericId, aliasId, displayName);
    }

    public Optional<String> getNumericId() {
        return Optional.ofNullable(numericId);
    }

    /**
     * Returns the alias, which is empty-string when resolved to "no alias".
     */
    public Optional<String> getAliasId() {
        return Optional.ofNullable(aliasId);
    }

    /**
     * Returns the alias only when the profile actually has one.
     */
    public Optional<String> knownAlias() {
        return aliasId == null || aliasId.isEmpty() ? Optional.empty() : Optional.of(aliasId);
    }

    public String getDisplayName() {
        return displayName;
    }

    public ProfileIdentity withNumericId(String newNumericId) {
        return new ProfileIdentity(newNumericId, aliasId, displayName);
    }

    /**
     * Identity test: numeric identifiers match when both are present, or aliases match when both
     * are present and non-empty.
     */
    public boolean sameIdentityAs(ProfileIdentity other) {
        if (other == null) {
            return false;
        }
        if (numericId != null && numericId.equals(other.numericId)) {
            return true;
        }
        return knownAlias().isPresent() && knownAlias().equals(other.knownAlias());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProfileIdentity that = (ProfileIdentity) o;
        return Objects.equals(numericId, that.numericId)
                && Objects.equals(aliasId, that.aliasId)
                && displayName.equals(that.displayName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numericId, aliasId, displayName);
    }

    @Override
    public String toString() {
        return "ProfileIdentity{" +
                "numericId='" + numericId + '\'' +
                ", aliasId='" + aliasId + '\'' +
                ", displayName='" + displayName + '\'' +
                '}';
    }
}
