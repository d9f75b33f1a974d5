package com.designlens.figma;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Design-tool API configuration bound from {@code designlens.figma.*}.
 */
@Component
@ConfigurationProperties(prefix = "designlens.figma")
public class FigmaProperties {

    /** Personal access token sent as {@code X-Figma-Token}. */
    private String apiToken = "";

    private String baseUrl = "https://api.figma.com/v1";

    private Duration timeout = Duration.ofSeconds(30);

    /** Export format for screenshots: png, jpg, svg or pdf. */
    private String imageFormat = "png";

    private double imageScale = 2.0;

    public String getApiToken() { return apiToken; }
    public void setApiToken(String apiToken) { this.apiToken = apiToken; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public String getImageFormat() { return imageFormat; }
    public void setImageFormat(String imageFormat) { this.imageFormat = imageFormat; }

    public double getImageScale() { return imageScale; }
    public void setImageScale(double imageScale) { this.imageScale = imageScale; }

    public boolean hasToken() {
        return apiToken != null && !apiToken.isBlank();
    }
}
