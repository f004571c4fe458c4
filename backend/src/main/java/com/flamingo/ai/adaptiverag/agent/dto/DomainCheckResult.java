package com.flamingo.ai.adaptiverag.agent.dto;

/** Structured output of {@code QuestionRoutingAgent.checkDomain}. */
public record DomainCheckResult(boolean inDomain, String reasoning) {}
