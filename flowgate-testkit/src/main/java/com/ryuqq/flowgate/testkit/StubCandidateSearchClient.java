package com.ryuqq.flowgate.testkit;

import com.ryuqq.flowgate.core.reconciliation.Candidate;
import com.ryuqq.flowgate.core.spi.CandidateSearchClient;
import com.ryuqq.flowgate.core.spi.CandidateSearchException;
import com.ryuqq.flowgate.core.spi.SearchOptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Programmable {@link CandidateSearchClient} for tests.
 *
 * <p>Responses are registered per label. Unknown labels return an empty list.
 * Returned candidates are sorted by score descending and truncated to {@link SearchOptions#limit()},
 * as a real registry client would.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * StubCandidateSearchClient client = new StubCandidateSearchClient()
 *     .respondWith("Apple", Candidate.of("Q312", 95, "Apple Inc."));
 *
 * // ... exercise engine ...
 *
 * assertEquals(1, client.invocationCount());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StubCandidateSearchClient implements CandidateSearchClient {

    private final Map<String, List<Candidate>> responses = new ConcurrentHashMap<>();
    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();
    private volatile CandidateSearchException failure;

    /**
     * Recorded search call.
     *
     * @param label searched label
     * @param options search options
     */
    public record Invocation(String label, SearchOptions options) {
    }

    /**
     * Registers candidates returned for a label.
     *
     * @param label label to match exactly
     * @param candidates candidates (any order)
     * @return this client
     */
    public StubCandidateSearchClient respondWith(String label, Candidate... candidates) {
        responses.put(label, List.of(candidates));
        return this;
    }

    /**
     * Makes every subsequent search throw the given exception.
     *
     * @param exception exception to throw, or null to stop failing
     * @return this client
     */
    public StubCandidateSearchClient failWith(CandidateSearchException exception) {
        this.failure = exception;
        return this;
    }

    @Override
    public List<Candidate> search(String label, SearchOptions options) {
        invocations.add(new Invocation(label, options));
        CandidateSearchException current = failure;
        if (current != null) {
            throw current;
        }

        List<Candidate> sorted = new ArrayList<>(responses.getOrDefault(label, List.of()));
        sorted.sort(Comparator.comparingDouble(Candidate::score).reversed());
        return List.copyOf(sorted.subList(0, Math.min(options.limit(), sorted.size())));
    }

    public int invocationCount() {
        return invocations.size();
    }

    public List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    /**
     * Clears registered responses, failures and recorded invocations.
     */
    public void reset() {
        responses.clear();
        invocations.clear();
        failure = null;
    }
}
