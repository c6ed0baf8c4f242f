package com.team.detection.cache;

import com.team.detection.core.model.ProfileDetails;
import com.team.detection.extract.ExtractionException;
import com.team.detection.extract.SteamRelationshipExtractor;
import com.team.detection.fixtures.SteamPages;
import com.team.detection.metrics.MetricsService;
import com.team.detection.resolve.IdentityResolutionTable;
import com.team.detection.source.ProfileSource;
import com.team.detection.source.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FetchCacheTest {

    private static final String ALICE = SteamPages.profile("1", "alice", "Alice", true, false, 0);
    private static final String EVE = SteamPages.profile("5", null, "Eve", true, false, 0);

    @Mock
    private ProfileSource source;

    @Mock
    private MetricsService metrics;

    private IdentityResolutionTable table;
    private FetchCache cache;

    @BeforeEach
    void setUp() {
        table = new IdentityResolutionTable();
        cache = new FetchCache(source, new SteamRelationshipExtractor(), table, metrics);
    }

    @Nested
    @DisplayName("Profile pages")
    class ProfileTests {

        @Test
        @DisplayName("Should fetch a profile once and serve repeats from memory")
        void fetchesOnce() {
            when(source.fetchProfile("1")).thenReturn(ALICE);

            assertEquals("Alice", cache.getProfileDetails("1").displayName());
            assertEquals("Alice", cache.getProfileDetails("1").displayName());

            verify(source, times(1)).fetchProfile("1");
            verify(metrics, times(1)).recordFetch(PageKind.PROFILE);
            verify(metrics, times(1)).recordCacheHit(PageKind.PROFILE);
            assertEquals(1, cache.getStats().hitCount());
            assertEquals(1, cache.getStats().missCount());
        }

        @Test
        @DisplayName("Should record the alias binding as a side effect")
        void recordsAlias() {
            when(source.fetchProfile("1")).thenReturn(ALICE);
            when(source.fetchProfile("5")).thenReturn(EVE);

            cache.getProfileDetails("1");
            cache.getProfileDetails("5");

            assertEquals("1", table.numericFor("alice").orElseThrow());
            assertEquals("", table.aliasFor("5").orElseThrow());
        }

        @Test
        @DisplayName("Should cache an alias fetch under the numeric key")
        void aliasFetchServesNumericKey() {
            when(source.fetchProfileByAlias("alice")).thenReturn(ALICE);

            cache.getProfileDetailsByAlias("alice");
            cache.getProfileDetails("1");
            cache.getProfileDetailsByAlias("alice");

            verify(source, times(1)).fetchProfileByAlias("alice");
            verify(source, never()).fetchProfile(anyString());
            assertTrue(cache.contains(PageKey.profile("1")));
        }

        @Test
        @DisplayName("Should parse each profile page once however it is reached")
        void parsesOnce() {
            SteamRelationshipExtractor extractor = spy(new SteamRelationshipExtractor());
            FetchCache parsing = new FetchCache(source, extractor, table, metrics);
            when(source.fetchProfileByAlias("alice")).thenReturn(ALICE);
            when(source.fetchProfile("5")).thenReturn(EVE);

            ProfileDetails byAlias = parsing.getProfileDetailsByAlias("alice");
            assertSame(byAlias, parsing.getProfileDetails("1"));
            ProfileDetails eve = parsing.getProfileDetails("5");
            assertSame(eve, parsing.getProfileDetails("5"));

            verify(extractor, times(1)).parseProfile(ALICE);
            verify(extractor, times(1)).parseProfile(EVE);
        }

        @Test
        @DisplayName("Should fail when an alias page carries no numeric id")
        void aliasWithoutNumericId() {
            when(source.fetchProfileByAlias("ghost")).thenReturn("<html>The specified profile could not be found.</html>");

            assertThrows(ExtractionException.class, () -> cache.getProfileDetailsByAlias("ghost"));
            assertTrue(table.numericFor("ghost").isEmpty());
        }

        @Test
        @DisplayName("Should not cache failed fetches")
        void failuresNotCached() {
            when(source.fetchProfile("1"))
                    .thenThrow(new TransportException("https://steamcommunity.com/profiles/1/?l=english", 503))
                    .thenReturn(ALICE);

            assertThrows(TransportException.class, () -> cache.getProfileDetails("1"));
            assertEquals("1", cache.getProfileDetails("1").numericId());
            verify(source, times(2)).fetchProfile("1");
        }
    }

    @Nested
    @DisplayName("List pages")
    class ListTests {

        @Test
        @DisplayName("Should key annotation pages by profile and page number")
        void annotationPages() {
            when(source.fetchAnnotationsPage("1", 1)).thenReturn("page-1");
            when(source.fetchAnnotationsPage("1", 2)).thenReturn("page-2");

            assertEquals("page-1", cache.getAnnotationsPage("1", 1));
            assertEquals("page-2", cache.getAnnotationsPage("1", 2));
            assertEquals("page-1", cache.getAnnotationsPage("1", 1));

            verify(source, times(1)).fetchAnnotationsPage("1", 1);
            assertEquals(2, cache.getStats().size());
        }

        @Test
        @DisplayName("Should fetch a relationship list once")
        void relationshipList() {
            when(source.fetchRelationshipList("1")).thenReturn("friends");

            cache.getRelationshipList("1");
            cache.getRelationshipList("1");

            verify(source, times(1)).fetchRelationshipList("1");
            verify(metrics).recordFetch(PageKind.RELATIONSHIP_LIST);
        }
    }

    @Test
    @DisplayName("Should drop every page on invalidateAll")
    void invalidateAll() {
        when(source.fetchRelationshipList("1")).thenReturn("friends");
        cache.getRelationshipList("1");

        when(source.fetchProfile("1")).thenReturn(ALICE);
        cache.getProfileDetails("1");

        cache.invalidateAll();
        cache.getProfileDetails("1");

        assertFalse(cache.contains(PageKey.relationshipList("1")));
        verify(source, times(2)).fetchProfile("1");
        assertEquals(1, cache.getStats().size());
    }
}
