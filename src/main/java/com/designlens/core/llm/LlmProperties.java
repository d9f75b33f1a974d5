package com.designlens.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "designlens.llm")
public class LlmProperties {

    private String model = "";
    private Duration timeout = Duration.ofSeconds(60);
    private int maxConcurrentCalls = 4;
    private double groupingTemperature = 0.2;
    private int groupingMaxTokens = 3000;
    private double visionTemperature = 0.1;
    private int visionMaxTokens = 4000;

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public void setMaxConcurrentCalls(int maxConcurrentCalls) {
        this.maxConcurrentCalls = maxConcurrentCalls;
    }

    public double getGroupingTemperature() {
        return groupingTemperature;
    }

    public void setGroupingTemperature(double groupingTemperature) {
        this.groupingTemperature = groupingTemperature;
    }

    public int getGroupingMaxTokens() {
        return groupingMaxTokens;
    }

    public void setGroupingMaxTokens(int groupingMaxTokens) {
        this.groupingMaxTokens = groupingMaxTokens;
    }

    public double getVisionTemperature() {
        return visionTemperature;
    }

    public void setVisionTemperature(double visionTemperature) {
        this.visionTemperature = visionTemperature;
    }

    public int getVisionMaxTokens() {
        return visionMaxTokens;
    }

    public void setVisionMaxTokens(int visionMaxTokens) {
        this.visionMaxTokens = visionMaxTokens;
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }

    public CallSettings groupingSettings() {
        return new CallSettings(groupingTemperature, groupingMaxTokens);
    }

    public CallSettings visionSettings() {
        return new CallSettings(visionTemperature, visionMaxTokens);
    }
}
