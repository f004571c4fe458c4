package com.flamingo.ai.adaptiverag.agent.dto;

/** Whether an answer resolves the user's question. */
public record UsefulnessGrade(boolean useful, String reasoning) {}
