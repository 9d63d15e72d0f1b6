package com.example.nexusmods.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the Nexus Mods client, bound from {@code nexusmods.*}.
 */
@ConfigurationProperties(prefix = "nexusmods")
public class NexusModsProperties {

    public static final String DEFAULT_BASE_URL = "https://api.nexusmods.com";
    public static final String DEFAULT_API_VERSION = "v1";

    /**
     * Personal API key, sent as the {@code apikey} header.
     */
    private String apiKey;

    /**
     * Scheme and host of the API, without trailing slash.
     */
    private String baseUrl = DEFAULT_BASE_URL;

    private String apiVersion = DEFAULT_API_VERSION;

    /**
     * Optional {@code Application-Name} header.
     */
    private String applicationName;

    /**
     * Optional {@code Application-Version} header.
     */
    private String applicationVersion;

    private String userAgent = "NexusModsClient v1.0";

    public static NexusModsProperties withApiKey(String apiKey) {
        NexusModsProperties properties = new NexusModsProperties();
        properties.setApiKey(apiKey);
        return properties;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public String getApplicationName() {
        return applicationName;
    }

    public void setApplicationName(String applicationName) {
        this.applicationName = applicationName;
    }

    public String getApplicationVersion() {
        return applicationVersion;
    }

    public void setApplicationVersion(String applicationVersion) {
        this.applicationVersion = applicationVersion;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    /**
     * Base URL including the version segment, e.g. {@code https://api.nexusmods.com/v1}.
     */
    public String getVersionedBaseUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/" + apiVersion;
    }
}
