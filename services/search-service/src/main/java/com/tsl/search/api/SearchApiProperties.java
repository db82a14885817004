package com.tsl.search.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.api")
public class SearchApiProperties {
    /**
     * Shared secret for the cache admin endpoints. When blank the endpoints reject every call.
     */
    private String adminApiKey;

    public String getAdminApiKey() {
        return adminApiKey;
    }

    public void setAdminApiKey(String adminApiKey) {
        this.adminApiKey = adminApiKey;
    }
}
