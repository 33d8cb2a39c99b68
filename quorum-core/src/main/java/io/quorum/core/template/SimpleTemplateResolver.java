package io.quorum.core.template;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Regex-based resolver for `{name}` placeholders.
///
/// Only identifier-shaped names are placeholders, so literal JSON in a template
/// (`{"findings": []}`) passes through untouched. Unknown placeholders are kept verbatim.
public class SimpleTemplateResolver implements TemplateResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

    @Override
    public String resolve(String template, Map<String, Object> variables) {
        if (template == null) {
            return "";
        }

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement =
                    variables.containsKey(name)
                            ? String.valueOf(variables.get(name))
                            : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }
}
