package com.example.audit.model;

import java.util.List;

/**
 * Wrapper for structured parsing of a strategy's LLM answer.
 * Used by Spring AI BeanOutputConverter to force a JSON object with a "findings" array.
 */
public record FindingsResponse(List<Finding> findings) {}
