package com.linlay.taskrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OpenAI-compatible endpoint backing the reasoning engine.
 */
@ConfigurationProperties(prefix = "agent.provider")
public class AgentProviderProperties {

    private String baseUrl = "https://api.openai.com";
    private String apiKey;
    private String model = "gpt-4o";
    private double temperature = 0.7;
    private int maxTokens = 4096;
    private boolean wiretap;

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

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public boolean isWiretap() {
        return wiretap;
    }

    public void setWiretap(boolean wiretap) {
        this.wiretap = wiretap;
    }
}
