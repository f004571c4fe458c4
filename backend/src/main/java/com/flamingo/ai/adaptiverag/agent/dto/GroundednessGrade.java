package com.flamingo.ai.adaptiverag.agent.dto;

/** Whether an answer is supported by the context it was generated from. */
public record GroundednessGrade(boolean grounded, String reasoning) {}
