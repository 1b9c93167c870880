package com.openforge.storeagent.routing;

import com.openforge.storeagent.common.StorageException;
import com.openforge.storeagent.domain.AgentTool;
import com.openforge.storeagent.llm.CompletionService;
import com.openforge.storeagent.llm.LlmClient;
import com.openforge.storeagent.llm.model.ChatRequest;
import com.openforge.storeagent.llm.model.ChatResponse;
import com.openforge.storeagent.llm.model.Message;
import com.openforge.storeagent.repository.AgentToolRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * First routing stage: a short completion call that names the one to
 * {@code max-domains} domains an admin message is about. The router then
 * only searches examples of those domains.
 *
 * The known domains are those of the active tools. A reply that names none
 * of them yields an empty set, which the router treats as "search all".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DomainClassifier {

    private final CompletionService          completionService;
    private final AgentToolRepository        toolRepository;
    private final DomainClassifierProperties properties;

    public boolean isEnabled() {
        return properties.enabled();
    }

    /**
     * @param onAttempt runs once per request sent to the provider
     * @throws LlmClient.LlmException if the completion call fails
     */
    public Classification classify(String query, Runnable onAttempt) {
        Set<String> known = knownDomains();
        if (known.isEmpty()) {
            return new Classification(Set.of(), 0, 0);
        }
        ChatRequest request = ChatRequest.builder()
                .model(properties.model().isBlank() ? completionService.modelName() : properties.model())
                .messages(List.of(
                        Message.system(systemPrompt(known)),
                        Message.user(("Classify this query into 1-%d relevant domains. "
                                + "Return ONLY the domain names, comma-separated.\n\nQuery: %s")
                                .formatted(properties.maxDomains(), query))))
                .temperature(0.0)
                .maxTokens(properties.maxTokens())
                .build();

        ChatResponse response = completionService.complete(request, onAttempt);
        String reply = response.choices() == null || response.choices().isEmpty()
                ? null
                : response.firstMessage().content();
        Set<String> domains = parse(reply, known);
        if (domains.isEmpty()) {
            log.debug("[Router] No known domain in classifier reply '{}', searching all", reply);
        } else {
            log.info("[Router] Classified into domains {}", domains);
        }
        return new Classification(domains, response.inputTokens(), response.outputTokens());
    }

    Set<String> parse(String reply, Set<String> known) {
        if (reply == null || reply.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(reply.split(","))
                .map(part -> part.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", ""))
                .filter(known::contains)
                .distinct()
                .limit(properties.maxDomains())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    String systemPrompt(Set<String> known) {
        StringBuilder prompt = new StringBuilder(
                "You are a classifier that categorizes e-commerce admin queries into domains.\n\nAvailable domains:\n");
        for (String domain : known) {
            String description = properties.descriptions().get(domain);
            prompt.append("- ").append(domain);
            if (description != null && !description.isBlank()) {
                prompt.append(": ").append(description);
            }
            prompt.append('\n');
        }
        prompt.append("\nRules:\n")
                .append("1. Return 1-").append(properties.maxDomains()).append(" most relevant domains\n")
                .append("2. Return ONLY domain names, comma-separated (e.g., \"orders, customers\")\n")
                .append("3. Most queries need only 1-2 domains\n")
                .append("4. Choose based on what data/actions the query requires");
        return prompt.toString();
    }

    private Set<String> knownDomains() {
        try {
            return toolRepository.findByIsActiveTrueOrderByToolNameAsc().stream()
                    .map(AgentTool::getDomain)
                    .filter(d -> d != null && !d.isBlank())
                    .collect(Collectors.toCollection(TreeSet::new));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load tool domains", e);
        }
    }

    /** Domains picked for a query plus the token usage of the call that picked them. */
    public record Classification(Set<String> domains, long inputTokens, long outputTokens) {}
}
