package io.quorum.core.template;

import java.util.Map;

/// Resolves `{name}` placeholders in prompt templates. Pure utility, no dependencies.
public interface TemplateResolver {
    String resolve(String template, Map<String, Object> variables);
}
