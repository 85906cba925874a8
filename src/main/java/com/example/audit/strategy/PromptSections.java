package com.example.audit.strategy;

import com.example.audit.model.QaPair;

import java.util.List;

/**
 * Renders the optional parts of an {@code AuditInput} as markdown blocks for the user prompt.
 * Each method returns an empty string when there is nothing to render.
 */
final class PromptSections {

    private PromptSections() {
        // utility class
    }

    static String qaResponses(List<QaPair> qaResponses) {
        if (qaResponses == null || qaResponses.isEmpty()) return "";

        StringBuilder sb = new StringBuilder("## Q&A Information\n");
        for (QaPair qa : qaResponses) {
            sb.append("Q: ").append(qa.question()).append('\n')
                    .append("A: ").append(qa.answer()).append("\n\n");
        }
        return sb.toString();
    }

    static String additionalLinks(List<String> links) {
        if (links == null || links.isEmpty()) return "";

        StringBuilder sb = new StringBuilder("## Additional References\n");
        for (String link : links) {
            sb.append("- ").append(link).append('\n');
        }
        return sb.toString();
    }

    static String additionalDocs(String additionalDocs) {
        if (additionalDocs == null || additionalDocs.isBlank()) return "";
        return "## Additional Documentation\n" + additionalDocs + "\n";
    }
}
