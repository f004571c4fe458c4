package com.flamingo.ai.adaptiverag.agent.dto;

/**
 * Structured output from QueryRefinementAgent. LangChain4j deserializes the model's JSON response
 * into this record.
 */
public record QueryRefinementResult(
    String query,
    String reasoning // optional
    ) {}
