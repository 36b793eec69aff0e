package com.phillippitts.gatesentry.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection and per-role model settings for the language and vision model clients.
 *
 * <p>The endpoint is OpenAI-compatible; a local Ollama server exposes one at {@code /v1}.
 */
@Validated
@ConfigurationProperties(prefix = "gate.llm")
public class LlmProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434/v1";

    /** Ollama ignores the key but the client requires one. */
    @NotBlank
    private String apiKey = "ollama";

    @NotNull
    private Duration timeout = Duration.ofSeconds(60);

    @Valid
    private ModelSettings main = new ModelSettings("gemma3n:e2b", 0.0);
    @Valid
    private ModelSettings validation = new ModelSettings("gemma3n:e2b", 0.1);
    @Valid
    private ModelSettings session = new ModelSettings("gemma3n:e2b", 0.1);
    @Valid
    private ModelSettings summary = new ModelSettings("gemma3n:e2b", 0.1);
    @Valid
    private ModelSettings decision = new ModelSettings("qwen3:4b", 0.0);
    @Valid
    private ModelSettings vision = new ModelSettings("gemma3n:e2b", 0.0);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public ModelSettings getMain() {
        return main;
    }

    public void setMain(ModelSettings main) {
        this.main = main;
    }

    public ModelSettings getValidation() {
        return validation;
    }

    public void setValidation(ModelSettings validation) {
        this.validation = validation;
    }

    public ModelSettings getSession() {
        return session;
    }

    public void setSession(ModelSettings session) {
        this.session = session;
    }

    public ModelSettings getSummary() {
        return summary;
    }

    public void setSummary(ModelSettings summary) {
        this.summary = summary;
    }

    public ModelSettings getDecision() {
        return decision;
    }

    public void setDecision(ModelSettings decision) {
        this.decision = decision;
    }

    public ModelSettings getVision() {
        return vision;
    }

    public void setVision(ModelSettings vision) {
        this.vision = vision;
    }

    /**
     * Model identifier and sampling temperature for one role.
     */
    public static class ModelSettings {
        @NotBlank
        private String modelName;
        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature;

        public ModelSettings() {
        }

        public ModelSettings(String modelName, double temperature) {
            this.modelName = modelName;
            this.temperature = temperature;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }
}
