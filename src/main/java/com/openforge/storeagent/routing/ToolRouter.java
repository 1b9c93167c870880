package com.openforge.storeagent.routing;

import com.openforge.storeagent.domain.ToolExample;
import com.openforge.storeagent.embedding.EmbeddingClient;
import com.openforge.storeagent.embedding.ScoredExample;
import com.openforge.storeagent.embedding.ToolExampleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps an admin utterance to the tool(s) it most likely asks for.
 *
 * Decision rule over the top-k hits (τ = confidence threshold, δ = margin):
 *
 *   top < τ                                   → NoMatch
 *   top ≥ τ, no other tool within δ of top    → Confident(top)
 *   top ≥ τ, other tools within δ of top      → Ambiguous(best hit of each such tool)
 *
 * Hits of the same tool never compete with each other; only the best
 * example per tool is considered for the margin.
 *
 * Learning: when the caller confirms that a routed tool was the right one,
 * the matched example's usage_count goes up and the utterance joins the
 * store as a learned example of that tool (an exact repeat of an existing
 * example only bumps that example's usage instead).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolRouter {

    private final EmbeddingClient  embeddingClient;
    private final ToolExampleStore store;
    private final RouterProperties properties;

    // ── Resolution ───────────────────────────────────────────────────────────

    /**
     * @throws EmbeddingClient.EmbeddingException if the utterance cannot be embedded
     */
    public RouteDecision resolve(String utterance, @Nullable String domainHint) {
        return resolve(embeddingClient.embed(utterance), domainHint);
    }

    public RouteDecision resolve(float[] queryEmbedding, @Nullable String domainHint) {
        return decide(store.search(queryEmbedding, properties.topK(), domainHint), domainHint);
    }

    /**
     * Resolves against the examples of {@code domains} only, as picked by the
     * {@link DomainClassifier}. An empty collection searches every domain.
     *
     * @throws EmbeddingClient.EmbeddingException if the utterance cannot be embedded
     */
    public RouteDecision resolveWithin(String utterance, Collection<String> domains) {
        float[] queryEmbedding = embeddingClient.embed(utterance);
        return decide(store.searchWithin(queryEmbedding, properties.topK(), domains),
                domains.isEmpty() ? null : String.join(",", domains));
    }

    private RouteDecision decide(List<ScoredExample> hits, @Nullable String scope) {
        if (hits.isEmpty()) {
            log.debug("[Router] No examples to match against (domain={})", scope);
            return new RouteDecision.NoMatch();
        }

        ScoredExample top = hits.get(0);
        if (top.score() < properties.confidenceThreshold()) {
            log.debug("[Router] NoMatch: top {} scored {} < {}",
                    top.toolName(), "%.4f".formatted(top.score()), properties.confidenceThreshold());
            return new RouteDecision.NoMatch();
        }

        Map<String, ScoredExample> bestPerTool = new LinkedHashMap<>();
        for (ScoredExample hit : hits) {
            bestPerTool.putIfAbsent(hit.toolName(), hit);
        }
        List<ScoredExample> contenders = bestPerTool.values().stream()
                .filter(hit -> top.score() - hit.score() <= properties.margin())
                .toList();

        if (contenders.size() == 1) {
            log.info("[Router] Confident: {} (example {}, score {})",
                    top.toolName(), top.example().getId(), "%.4f".formatted(top.score()));
            return new RouteDecision.Confident(top.toolName(), top.example(), top.score());
        }
        log.info("[Router] Ambiguous between {}", contenders.stream().map(ScoredExample::toolName).toList());
        return new RouteDecision.Ambiguous(contenders);
    }

    // ── Learning feedback ────────────────────────────────────────────────────

    /**
     * Records that {@code utterance} was correctly served by the tool of
     * example {@code matchedExampleId}.
     *
     * @return false when the example no longer exists
     */
    public boolean confirm(String utterance, Long matchedExampleId) {
        Optional<ToolExample> matched = store.findById(matchedExampleId);
        if (matched.isEmpty()) {
            log.warn("[Router] Cannot confirm, example {} is gone", matchedExampleId);
            return false;
        }
        ToolExample example = matched.get();
        store.recordUsage(example.getId());
        if (properties.learningEnabled()) {
            learn(utterance, example);
        }
        return true;
    }

    private void learn(String utterance, ToolExample matched) {
        String query = utterance == null ? "" : utterance.strip();
        if (query.isEmpty() || query.equals(matched.getExampleQuery())) {
            return;
        }
        Optional<ToolExample> existing = store.findExample(matched.getToolName(), query);
        if (existing.isPresent()) {
            store.recordUsage(existing.get().getId());
            log.debug("[Router] Utterance already known for {}, usage bumped", matched.getToolName());
            return;
        }
        ToolExample learned = store.addLearnedExample(
                matched.getToolName(), matched.getDomain(), query, embeddingClient.embed(query));
        log.info("[Router] Learned example {} for {}", learned.getId(), matched.getToolName());
    }
}
