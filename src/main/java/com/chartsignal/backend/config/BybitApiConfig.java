package com.chartsignal.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Public market-data endpoint settings. Only unauthenticated kline calls are made,
 * so no key or secret is configured.
 */
@Configuration
@ConfigurationProperties(prefix = "bybit.api")
public class BybitApiConfig {

    private String baseUrl = "https://api.bybit.com";
    private String testnetBaseUrl = "https://api-testnet.bybit.com";
    private boolean testnet = false;
    private String category = "linear";
    private String fallbackCategory = "spot";
    private int maxKlineLimit = 1000;
    private int connectTimeoutSeconds = 10;
    private int readTimeoutSeconds = 30;
    private String userAgent = "Chart-Signal-Backend/0.1";

    public String getBaseUrl() {
        return testnet ? testnetBaseUrl : baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getTestnetBaseUrl() {
        return testnetBaseUrl;
    }

    public void setTestnetBaseUrl(String testnetBaseUrl) {
        this.testnetBaseUrl = testnetBaseUrl;
    }

    public boolean isTestnet() {
        return testnet;
    }

    public void setTestnet(boolean testnet) {
        this.testnet = testnet;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getFallbackCategory() {
        return fallbackCategory;
    }

    public void setFallbackCategory(String fallbackCategory) {
        this.fallbackCategory = fallbackCategory;
    }

    public int getMaxKlineLimit() {
        return maxKlineLimit;
    }

    public void setMaxKlineLimit(int maxKlineLimit) {
        this.maxKlineLimit = maxKlineLimit;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public int getReadTimeoutSeconds() {
        return readTimeoutSeconds;
    }

    public void setReadTimeoutSeconds(int readTimeoutSeconds) {
        this.readTimeoutSeconds = readTimeoutSeconds;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getKlineUrl() {
        return getBaseUrl() + "/v5/market/kline";
    }
}
