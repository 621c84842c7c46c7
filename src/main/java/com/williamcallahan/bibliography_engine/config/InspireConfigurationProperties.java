/**
 * INSPIRE HEP API configuration properties
 *
 * @author William Callahan
 */

package com.williamcallahan.bibliography_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "inspire")
public class InspireConfigurationProperties {
    @NestedConfigurationProperty
    private Api api = new Api();

    public Api getApi() { return api; }
    public void setApi(Api api) { this.api = api; }

    public static class Api {
        private boolean enabled = true;
        private String baseUrl = "https://inspirehep.net/api";
        private String userAgent = "bibliography-engine/1.0 (scientific bibliography manager)";
        private int batchSize = 50;
        private int referencesRows = 200;
        private int citationsRows = 200;
        private int searchRows = 5;
        private int maxRetries = 3;
        private Duration timeout = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public int getReferencesRows() { return referencesRows; }
        public void setReferencesRows(int referencesRows) { this.referencesRows = referencesRows; }

        public int getCitationsRows() { return citationsRows; }
        public void setCitationsRows(int citationsRows) { this.citationsRows = citationsRows; }

        public int getSearchRows() { return searchRows; }
        public void setSearchRows(int searchRows) { this.searchRows = searchRows; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
