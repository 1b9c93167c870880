package com.openforge.storeagent.routing;

import com.openforge.storeagent.domain.ToolExample;
import com.openforge.storeagent.embedding.ScoredExample;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of routing one utterance. None of the variants is an error:
 * NoMatch tells the caller to offer the full tool list instead of a
 * routed subset.
 */
public sealed interface RouteDecision
        permits RouteDecision.Confident, RouteDecision.Ambiguous, RouteDecision.NoMatch {

    /** Tools this decision points at, best first; empty for NoMatch. */
    List<String> toolNames();

    /** The example that supported {@code toolName}, if this decision contains it. */
    Optional<ToolExample> matchFor(String toolName);

    record Confident(String toolName, ToolExample matchedExample, double score) implements RouteDecision {

        @Override
        public List<String> toolNames() {
            return List.of(toolName);
        }

        @Override
        public Optional<ToolExample> matchFor(String name) {
            return toolName.equals(name) ? Optional.of(matchedExample) : Optional.empty();
        }
    }

    /** Best example per tool, within the margin of the top score, in ranking order. */
    record Ambiguous(List<ScoredExample> candidates) implements RouteDecision {

        public Ambiguous {
            candidates = List.copyOf(candidates);
        }

        @Override
        public List<String> toolNames() {
            return candidates.stream().map(ScoredExample::toolName).toList();
        }

        @Override
        public Optional<ToolExample> matchFor(String name) {
            return candidates.stream()
                    .filter(c -> c.toolName().equals(name))
                    .map(ScoredExample::example)
                    .findFirst();
        }
    }

    record NoMatch() implements RouteDecision {

        @Override
        public List<String> toolNames() {
            return List.of();
        }

        @Override
        public Optional<ToolExample> matchFor(String name) {
            return Optional.empty();
        }
    }
}
