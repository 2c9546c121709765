package com.example.notebookengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Central configuration for the notebook engine.
 * Maps to the 'notebook-engine' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "notebook-engine")
public class EngineProperties {

    private ExecutionConfig execution = new ExecutionConfig();
    private JobConfig jobs = new JobConfig();
    private LlmConfig llm = new LlmConfig();
    private CriticConfig critic = new CriticConfig();
    private GatewayConfig gateway = new GatewayConfig();
    private TemplateConfig templates = new TemplateConfig();

    @Data
    public static class ExecutionConfig {
        private boolean defaultStopOnError = true;
        /** Persist the variable context on the notebook so a paused run can resume in another process */
        private boolean persistVariables = true;
    }

    @Data
    public static class JobConfig {
        private int maxDurationSeconds = 600;
        private int maxAttempts = 2;
        private long minBackoffMs = 5000;
        private long maxBackoffMs = 30000;
        private long watchdogIntervalMs = 5000;
        /** How long a job stays pollable after it was queued */
        private long retentionMinutes = 60;
        private long maxRetainedJobs = 1000;
    }

    @Data
    public static class LlmConfig {
        private String provider = "openai";
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-4o-mini";
        private String apiKey = "";
        private double temperature = 0.2;
        private int maxTokens = 2048;
        private int timeoutSeconds = 120;
    }

    @Data
    public static class CriticConfig {
        private boolean enabled = false;
        /** Model used for reviews; falls back to the llm model when blank */
        private String model = "";
        private int lowConfidenceThreshold = 60;
    }

    @Data
    public static class GatewayConfig {
        private String websocketPath = "/ws/notebooks";
    }

    @Data
    public static class TemplateConfig {
        private String directory = "./notebook-templates";
    }
}
