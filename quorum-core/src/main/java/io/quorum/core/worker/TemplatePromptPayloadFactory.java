package io.quorum.core.worker;

import io.quorum.core.partition.WorkUnit;
import io.quorum.core.roster.WorkerAssignment;
import io.quorum.core.template.TemplateResolver;
import java.util.HashMap;
import java.util.Map;

/// Renders prompt payloads from a text template.
///
/// ### Available placeholders
/// - `{unit_id}`, `{unit_label}`, `{unit_size}`
/// - `{patterns}`: comma-separated resource patterns
/// - `{role}`, `{role_focus}`
/// - `{oversized}`: `true` or `false`
public class TemplatePromptPayloadFactory implements PromptPayloadFactory {

    public static final String DEFAULT_TEMPLATE =
            """
            You are reviewing the work unit {unit_id} ({unit_label}).
            Resources in scope: {patterns}
            Your role: {role}. Focus on {role_focus}.

            Report every issue you find as JSON:
            {"findings": [{"severity": "critical|high|medium|low|info",
                           "location": "path:line",
                           "description": "...",
                           "recommendation": "..."}],
             "health_score": 0-10,
             "claimed_mutations": [{"target": "path", "expected_signal": "present"}]}
            Report an empty findings list if the unit has no issues.
            """;

    private final TemplateResolver templateResolver;
    private final String template;

    public TemplatePromptPayloadFactory(TemplateResolver templateResolver) {
        this(templateResolver, DEFAULT_TEMPLATE);
    }

    public TemplatePromptPayloadFactory(TemplateResolver templateResolver, String template) {
        this.templateResolver = templateResolver;
        this.template = template;
    }

    @Override
    public PromptPayload create(WorkUnit unit, WorkerAssignment assignment) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("unit_id", unit.id());
        variables.put("unit_label", unit.label());
        variables.put("unit_size", unit.estimatedSize());
        variables.put("patterns", String.join(", ", unit.resourcePatterns()));
        variables.put("role", assignment.role().id());
        variables.put("role_focus", assignment.role().getFocus());
        variables.put("oversized", unit.oversized());
        String text = templateResolver.resolve(template, variables);
        return new PromptPayload(unit.id(), assignment.role(), text);
    }
}
