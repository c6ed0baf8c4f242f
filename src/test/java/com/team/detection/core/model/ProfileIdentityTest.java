package com.team.detection.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProfileIdentityTest {

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Should require at least one identifier")
        void requiresIdentifier() {
            assertThrows(IllegalArgumentException.class, () -> ProfileIdentity.of(null, null, "Alice"));
            assertThrows(IllegalArgumentException.class, () -> ProfileIdentity.of(null, "", "Alice"));
        }

        @Test
        @DisplayName("Should distinguish unresolved alias from no alias")
        void aliasStates() {
            ProfileIdentity unresolved = ProfileIdentity.ofNumeric("1", "Alice");
            ProfileIdentity noAlias = ProfileIdentity.resolved("1", "", "Alice");
            ProfileIdentity withAlias = ProfileIdentity.resolved("1", "alice", "Alice");

            assertTrue(unresolved.getAliasId().isEmpty());
            assertEquals("", noAlias.getAliasId().orElseThrow());
            assertTrue(noAlias.knownAlias().isEmpty());
            assertEquals("alice", withAlias.knownAlias().orElseThrow());
        }

        @Test
        @DisplayName("Should keep alias and name when numeric id is filled in")
        void withNumericId() {
            ProfileIdentity identity = ProfileIdentity.ofAlias("bob", "Bob").withNumericId("2");

            assertEquals("2", identity.getNumericId().orElseThrow());
            assertEquals("bob", identity.knownAlias().orElseThrow());
            assertEquals("Bob", identity.getDisplayName());
        }
    }

    @Nested
    @DisplayName("sameIdentityAs")
    class IdentityTests {

        @Test
        @DisplayName("Should match on numeric id regardless of name")
        void numericMatch() {
            assertTrue(ProfileIdentity.ofNumeric("1", "Alice")
                    .sameIdentityAs(ProfileIdentity.ofNumeric("1", "Renamed")));
        }

        @Test
        @DisplayName("Should match on alias when numeric ids are unknown")
        void aliasMatch() {
            assertTrue(ProfileIdentity.ofAlias("alice", "Alice")
                    .sameIdentityAs(ProfileIdentity.of("1", "alice", "Alice")));
        }

        @Test
        @DisplayName("Should never match on display name alone")
        void nameNeverMatches() {
            assertFalse(ProfileIdentity.ofNumeric("1", "Alice")
                    .sameIdentityAs(ProfileIdentity.ofNumeric("2", "Alice")));
        }

        @Test
        @DisplayName("Should not treat two empty aliases as the same profile")
        void emptyAliasesDoNotMatch() {
            assertFalse(ProfileIdentity.resolved("1", "", "A")
                    .sameIdentityAs(ProfileIdentity.resolved("2", "", "B")));
        }

        @Test
        @DisplayName("Should not match null")
        void nullNeverMatches() {
            assertFalse(ProfileIdentity.ofNumeric("1", "Alice").sameIdentityAs(null));
        }
    }
}
