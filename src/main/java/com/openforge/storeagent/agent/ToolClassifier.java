package com.openforge.storeagent.agent;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Static read/write split of the tool catalog. Anything listed under
 * {@code agent.tools.mutating} needs a human decision before it runs.
 */
@Component
@RequiredArgsConstructor
public class ToolClassifier {

    private final ToolPolicyProperties policy;

    public boolean isMutating(String toolName) {
        return policy.mutating() != null && policy.mutating().contains(toolName);
    }
}
