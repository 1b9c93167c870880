package com.openforge.storeagent.routing.dto;

import com.openforge.storeagent.embedding.ScoredExample;
import com.openforge.storeagent.routing.RouteDecision;

import java.util.List;

/**
 * Wire view of a {@link RouteDecision}; kind is CONFIDENT, AMBIGUOUS or NO_MATCH.
 */
public record RouteResponse(String kind, List<Candidate> candidates) {

    public record Candidate(String toolName, Long exampleId, String exampleQuery, double score) {}

    public static RouteResponse from(RouteDecision decision) {
        if (decision instanceof RouteDecision.Confident c) {
            return new RouteResponse("CONFIDENT", List.of(new Candidate(
                    c.toolName(), c.matchedExample().getId(), c.matchedExample().getExampleQuery(), c.score())));
        }
        if (decision instanceof RouteDecision.Ambiguous a) {
            return new RouteResponse("AMBIGUOUS", a.candidates().stream().map(RouteResponse::candidate).toList());
        }
        return new RouteResponse("NO_MATCH", List.of());
    }

    private static Candidate candidate(ScoredExample hit) {
        return new Candidate(hit.toolName(), hit.example().getId(), hit.example().getExampleQuery(), hit.score());
    }
}
