package com.transparency.assessment.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "assessment")
public record AssessmentProperties(@DefaultValue Scoring scoring,
                                   @DefaultValue Report report,
                                   @DefaultValue Llm llm,
                                   @DefaultValue Executor executor,
                                   @DefaultValue Auth auth) {

    public record Scoring(@DefaultValue("20s") Duration timeout,
                          @DefaultValue("50") int fallbackScore,
                          @DefaultValue("0.1") double temperature,
                          @DefaultValue("50") int maxTokens) {}

    public record Report(@DefaultValue("120s") Duration timeout,
                         @DefaultValue("0.1") double temperature,
                         @DefaultValue("8000") int maxTokens) {}

    public record Llm(@DefaultValue("https://api.groq.com/openai/v1") String baseUrl,
                      @DefaultValue("not-configured") String apiKey,
                      @DefaultValue("llama-3.1-70b-versatile") String scoringModel,
                      @DefaultValue("qwen/qwen3-32b") String reportModel,
                      @DefaultValue("180s") Duration timeout) {}

    /** Scoring and report calls never share a pool. */
    public record Executor(@DefaultValue("8") int scoringPoolSize,
                           @DefaultValue("2") int reportPoolSize) {}

    /** Accepted bearer tokens; empty means any non-blank token passes. */
    public record Auth(@DefaultValue List<String> tokens) {}
}
