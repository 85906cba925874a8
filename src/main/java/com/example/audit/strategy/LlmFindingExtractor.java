package com.example.audit.strategy;

import com.example.audit.config.AuditProperties;
import com.example.audit.error.MalformedFindingsException;
import com.example.audit.model.AuditInput;
import com.example.audit.model.Finding;
import com.example.audit.model.FindingsResponse;
import com.example.audit.service.ResilientLlmCaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Shared LLM plumbing for the prompt-based strategies: builds the user prompt from the
 * audit input, calls the model and validates the findings it returns.
 */
@Component
public class LlmFindingExtractor {

    private static final Logger log = LoggerFactory.getLogger(LlmFindingExtractor.class);

    private static final String USER_PROMPT = """
            Audit the following Solidity smart contracts.
            Report only vulnerabilities you can point to in the code below.
            If you find nothing in your area of focus, return an empty "findings" list.

            For each finding provide:
            - "title": a short label of the vulnerability
            - "description": what is wrong, how it can be exploited and its impact
            - "severity": one of Critical, High, Medium, Low, Informational
            - "locations": the file paths of the affected contracts, exactly as they appear in the sources

            ## Contracts
            ===BEGIN CONTRACTS===
            %s
            ===END CONTRACTS===

            ## Documentation
            %s

            %s%s%s""";

    private final ChatClient chatClient;
    private final ResilientLlmCaller caller;
    private final int maxPromptChars;

    public LlmFindingExtractor(@Qualifier("analysisChatClient") ChatClient chatClient,
                               ResilientLlmCaller caller,
                               AuditProperties properties) {
        this.chatClient = chatClient;
        this.caller = caller;
        this.maxPromptChars = properties.maxPromptChars();
    }

    /**
     * Runs one strategy prompt against the input.
     *
     * @param strategy     strategy name (logging and error reporting)
     * @param systemPrompt the strategy's system prompt
     * @param input        shared audit input
     * @return validated findings, in the order the model reported them
     * @throws com.example.audit.error.StrategyExecutionException if the call fails or a finding is malformed
     */
    public List<Finding> extract(String strategy, String systemPrompt, AuditInput input) {
        log.info("[{}] Sending audit request ({} characters of contracts)", strategy, input.contracts().length());

        FindingsResponse response = caller.callEntity(
                chatClient, systemPrompt, userPrompt(input), FindingsResponse.class, strategy);

        List<Finding> findings = validate(strategy, response);
        log.info("[{}] Analysis completed successfully with {} findings", strategy, findings.size());
        return findings;
    }

    String userPrompt(AuditInput input) {
        return USER_PROMPT.formatted(
                truncate(input.contracts(), maxPromptChars),
                input.docs(),
                PromptSections.additionalLinks(input.additionalLinks()),
                PromptSections.additionalDocs(input.additionalDocs()),
                PromptSections.qaResponses(input.qaResponses()));
    }

    static List<Finding> validate(String strategy, FindingsResponse response) {
        if (response == null || response.findings() == null) {
            log.warn("[{}] Null findings in LLM response, treating as no findings", strategy);
            return List.of();
        }

        List<Finding> findings = response.findings();
        for (int i = 0; i < findings.size(); i++) {
            Finding finding = findings.get(i);
            if (finding == null) {
                throw new MalformedFindingsException(strategy, i, "null entry");
            }
            if (finding.title().isBlank()) {
                throw new MalformedFindingsException(strategy, i, "missing title");
            }
            if (finding.description().isBlank()) {
                throw new MalformedFindingsException(strategy, i, "missing description");
            }
            if (finding.severity().isBlank()) {
                throw new MalformedFindingsException(strategy, i, "missing severity");
            }
        }
        return List.copyOf(findings);
    }

    private static String truncate(String text, int maxChars) {
        if (maxChars <= 0 || text.length() <= maxChars) return text;
        return text.substring(0, maxChars) + "\n[... truncated ...]";
    }
}
