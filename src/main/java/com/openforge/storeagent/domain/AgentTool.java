package com.openforge.storeagent.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * One backend operation the completion API may invoke.
 *
 * The inputSchema column stores a JSON Schema object that is injected
 * verbatim into the "tools" array of each completion request.
 *
 * entryPoint is the Spring bean name of the {@code ToolHandler} that runs
 * the operation against the commerce back end. Whether a tool needs human
 * approval is not stored here; it comes from {@code agent.tools.mutating}.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "agent_tools",
    uniqueConstraints = @UniqueConstraint(name = "uq_tool_name", columnNames = "tool_name")
)
public class AgentTool extends BaseEntity {

    /** Function name in completion calls. */
    @Column(name = "tool_name", nullable = false, length = 128)
    private String toolName;

    /** Coarse grouping used to scope similarity search, e.g. "orders". */
    @Column(name = "domain", nullable = false, length = 64)
    private String domain;

    @Column(name = "tool_description", nullable = false, columnDefinition = "TEXT")
    private String toolDescription;

    @Column(name = "input_schema", nullable = false, columnDefinition = "TEXT")
    private String inputSchema;

    @Column(name = "entry_point", length = 256)
    private String entryPoint;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;
}
