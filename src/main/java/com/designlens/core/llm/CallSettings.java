package com.designlens.core.llm;

/**
 * Sampling settings for one call.
 */
public record CallSettings(double temperature, int maxTokens) {}
