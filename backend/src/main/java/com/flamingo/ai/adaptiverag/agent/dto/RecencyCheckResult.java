package com.flamingo.ai.adaptiverag.agent.dto;

/** Structured output of {@code QuestionRoutingAgent.checkRecency}. */
public record RecencyCheckResult(boolean needsCurrentInformation, String reasoning) {}
