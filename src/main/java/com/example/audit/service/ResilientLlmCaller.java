package com.example.audit.service;

import com.example.audit.config.AuditProperties;
import com.example.audit.error.StrategyExecutionException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.time.Duration;

/**
 * Calls the model for one strategy and turns its answer into a typed object.
 * <p>
 * Model answers are parsed leniently: trailing commas, Java comments, single quotes and
 * unquoted field names are accepted and unknown fields are ignored. A failed attempt is retried
 * up to {@code maxRetries} times with a linearly growing pause.
 * <p>
 * Strategies are cancelled by interrupting their thread, and some HTTP clients clear the
 * interrupt flag while turning it into an I/O error. Such a failure ends the call at once,
 * whether or not the flag is still set.
 */
@Component
public class ResilientLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientLlmCaller.class);

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final int maxRetries;
    private final Duration backoff;

    @Autowired
    public ResilientLlmCaller(AuditProperties properties) {
        this(properties.llmMaxRetries(), properties.llmRetryBackoff());
    }

    public ResilientLlmCaller(int maxRetries, Duration backoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.backoff = backoff != null ? backoff : Duration.ZERO;
    }

    /**
     * Asks the model and converts the answer to {@code type}. The JSON schema of {@code type}
     * is appended to the user prompt.
     *
     * @param strategy strategy on whose behalf the call is made, carried by any exception
     * @throws StrategyExecutionException if every attempt fails or the call is interrupted
     */
    public <T> T callEntity(ChatClient chatClient, String systemPrompt, String userPrompt,
                            Class<T> type, String strategy) {
        BeanOutputConverter<T> converter = new BeanOutputConverter<>(type, LENIENT_MAPPER);
        String prompt = userPrompt + "\n\n" + converter.getFormat();
        int attempts = maxRetries + 1;

        Exception lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new StrategyExecutionException(strategy, "interrupted before attempt " + attempt, lastError);
            }
            try {
                return converter.convert(answer(chatClient, systemPrompt, prompt, strategy));
            } catch (Exception e) {
                if (causedByInterrupt(e)) {
                    Thread.currentThread().interrupt();
                    throw new StrategyExecutionException(strategy, "interrupted during attempt " + attempt, e);
                }
                lastError = e;
                if (attempt < attempts) {
                    pause(attempt, e, strategy);
                }
            }
        }
        throw new StrategyExecutionException(strategy,
                "model call failed after " + attempts + " attempt(s): " + rootCauseMessage(lastError), lastError);
    }

    private String answer(ChatClient chatClient, String systemPrompt, String prompt, String strategy) {
        ChatResponse response = chatClient.prompt()
                .system(systemPrompt)
                .user(prompt)
                .call()
                .chatResponse();

        if (response == null || response.getResult() == null) {
            throw new IllegalStateException("model returned no result");
        }
        logTokenUsage(response, strategy);

        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("model returned empty content");
        }
        return text;
    }

    private void pause(int attempt, Exception cause, String strategy) {
        Duration delay = backoff.multipliedBy(attempt);
        log.warn("[{}] attempt {}/{} failed ({}), retrying in {}ms",
                strategy, attempt, maxRetries + 1, rootCauseMessage(cause), delay.toMillis());
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StrategyExecutionException(strategy, "interrupted while backing off", cause);
        }
    }

    private static void logTokenUsage(ChatResponse response, String strategy) {
        var metadata = response.getMetadata();
        if (metadata == null || metadata.getUsage() == null) return;
        var usage = metadata.getUsage();
        if (usage.getTotalTokens() == null || usage.getTotalTokens() == 0) return;

        log.debug("[{}] {} tokens (prompt {}, completion {}, model={})", strategy,
                usage.getTotalTokens(), usage.getPromptTokens(), usage.getCompletionTokens(), metadata.getModel());
    }

    static boolean causedByInterrupt(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException
                    || (t instanceof InterruptedIOException && !(t instanceof SocketTimeoutException))
                    || t instanceof ClosedByInterruptException) {
                return true;
            }
        }
        return false;
    }

    private static String rootCauseMessage(Throwable e) {
        if (e == null) return "unknown error";
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage();
        return msg != null && msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
