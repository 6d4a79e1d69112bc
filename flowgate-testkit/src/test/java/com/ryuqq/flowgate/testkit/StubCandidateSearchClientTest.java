package com.ryuqq.flowgate.testkit;

import com.ryuqq.flowgate.core.reconciliation.Candidate;
import com.ryuqq.flowgate.core.spi.SearchOptions;
import com.ryuqq.flowgate.core.spi.SearchRateLimitedException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link StubCandidateSearchClient}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StubCandidateSearchClientTest {

    @Test
    void search_ReturnsCandidatesSortedByScoreAndLimited() {
        // Given
        StubCandidateSearchClient client = new StubCandidateSearchClient().respondWith("Apple",
            Candidate.of("Q89", 40, "apple"),
            Candidate.of("Q312", 95, "Apple Inc."),
            Candidate.of("Q213710", 60, "Apple Records"));

        // When
        List<Candidate> candidates = client.search("Apple", new SearchOptions("en", 2));

        // Then
        assertEquals(List.of("Q312", "Q213710"), candidates.stream().map(Candidate::id).toList());
    }

    @Test
    void search_UnknownLabel_ReturnsEmptyAndRecordsInvocation() {
        // Given
        StubCandidateSearchClient client = new StubCandidateSearchClient();

        // When
        List<Candidate> candidates = client.search("Nothing", new SearchOptions("en", 5));

        // Then
        assertTrue(candidates.isEmpty());
        assertEquals(1, client.invocationCount());
        assertEquals("Nothing", client.invocations().get(0).label());
    }

    @Test
    void failWith_ThrowsConfiguredException() {
        // Given
        SearchRateLimitedException failure = new SearchRateLimitedException("slow down", 5_000);
        StubCandidateSearchClient client = new StubCandidateSearchClient().failWith(failure);

        // When & Then
        SearchRateLimitedException thrown = assertThrows(SearchRateLimitedException.class,
            () -> client.search("Apple", new SearchOptions("en", 5)));
        assertSame(failure, thrown);
        assertEquals(1, client.invocationCount());
    }

    @Test
    void reset_ClearsEverything() {
        // Given
        StubCandidateSearchClient client = new StubCandidateSearchClient()
            .respondWith("Apple", Candidate.of("Q312", 95, "Apple Inc."))
            .failWith(new SearchRateLimitedException("slow down", 1));

        // When
        client.reset();

        // Then
        assertTrue(client.search("Apple", new SearchOptions("en", 5)).isEmpty());
        assertEquals(1, client.invocationCount());
    }
}
