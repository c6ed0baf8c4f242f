package com.team.detection.source;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SteamProfileSourceTest {

    @Mock
    private PageFetcher fetcher;

    private SteamProfileSource source;

    @BeforeEach
    void setUp() {
        source = new SteamProfileSource(fetcher);
    }

    @Test
    @DisplayName("Should request English profile pages by number and by alias")
    void profileUrls() {
        when(fetcher.fetch(anyString())).thenReturn("page");

        source.fetchProfile("1");
        source.fetchProfileByAlias("alice");

        verify(fetcher).fetch("https://steamcommunity.com/profiles/1/?l=english");
        verify(fetcher).fetch("https://steamcommunity.com/id/alice/?l=english");
    }

    @Test
    @DisplayName("Should request friends and paginated comments")
    void listUrls() {
        when(fetcher.fetch(anyString())).thenReturn("page");

        source.fetchRelationshipList("1");
        source.fetchAnnotationsPage("1", 2);

        verify(fetcher).fetch("https://steamcommunity.com/profiles/1/friends/?l=english");
        verify(fetcher).fetch("https://steamcommunity.com/profiles/1/allcomments/?l=english&ctp=2");
    }

    @Test
    @DisplayName("Should reject page numbers below one")
    void rejectsPageZero() {
        assertThrows(IllegalArgumentException.class, () -> source.fetchAnnotationsPage("1", 0));
        verifyNoInteractions(fetcher);
    }

    @Test
    @DisplayName("Should build the canonical link without fetching")
    void profileLink() {
        assertEquals("https://steamcommunity.com/profiles/1/?l=english", source.profileLink("1"));
        verifyNoInteractions(fetcher);
    }
}
