/**
 * Main application configuration properties
 * Centralizes all app.* configuration properties for better type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.bibliography_engine.config;

import com.williamcallahan.bibliography_engine.model.PaperSource;
import com.williamcallahan.bibliography_engine.types.SourceCapabilities;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "app")
public class AppConfigurationProperties {

    @NestedConfigurationProperty
    private Sync sync = new Sync();

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    @NestedConfigurationProperty
    private Library library = new Library();

    /** Per-source capabilities and priority, keyed by source name (e.g. ads, inspire, arxiv) */
    private Map<String, Source> sources = new LinkedHashMap<>();

    // Getters and setters
    public Sync getSync() { return sync; }
    public void setSync(Sync sync) { this.sync = sync; }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public Library getLibrary() { return library; }
    public void setLibrary(Library library) { this.library = library; }

    public Map<String, Source> getSources() { return sources; }
    public void setSources(Map<String, Source> sources) { this.sources = sources; }

    /**
     * Configured settings for a source, or an all-false default at priority 50 when unknown
     */
    public Source sourceSettings(String sourceName) {
        if (sourceName == null) {
            return new Source();
        }
        Source configured = sources.get(sourceName.toLowerCase(Locale.ROOT));
        return configured != null ? configured : new Source();
    }

    // Nested configuration classes
    public static class Sync {
        private String source = "ads";
        private int windowWidth = 10;
        private Duration interWindowDelay = Duration.ofMillis(50);
        private Duration lookupTimeout = Duration.ofSeconds(30);
        private Duration assistTimeout = Duration.ofSeconds(30);
        private boolean refreshCitationGraphs = false;
        private int contentScanLength = 5000;

        public String getSource() { return source; }
        public void setSource(String source) { this.source = source; }

        public int getWindowWidth() { return windowWidth; }
        public void setWindowWidth(int windowWidth) { this.windowWidth = windowWidth; }

        public Duration getInterWindowDelay() { return interWindowDelay; }
        public void setInterWindowDelay(Duration interWindowDelay) { this.interWindowDelay = interWindowDelay; }

        public Duration getLookupTimeout() { return lookupTimeout; }
        public void setLookupTimeout(Duration lookupTimeout) { this.lookupTimeout = lookupTimeout; }

        public Duration getAssistTimeout() { return assistTimeout; }
        public void setAssistTimeout(Duration assistTimeout) { this.assistTimeout = assistTimeout; }

        public boolean isRefreshCitationGraphs() { return refreshCitationGraphs; }
        public void setRefreshCitationGraphs(boolean refreshCitationGraphs) { this.refreshCitationGraphs = refreshCitationGraphs; }

        public int getContentScanLength() { return contentScanLength; }
        public void setContentScanLength(int contentScanLength) { this.contentScanLength = contentScanLength; }
    }

    public static class Cache {
        private Duration freshness = Duration.ofDays(7);

        public Duration getFreshness() { return freshness; }
        public void setFreshness(Duration freshness) { this.freshness = freshness; }
    }

    public static class Library {
        private String path;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }

    public static class Source {
        private boolean references;
        private boolean citations;
        private boolean pdf;
        private boolean bibtex;
        private int priority = PaperSource.DEFAULT_PRIORITY;

        public boolean isReferences() { return references; }
        public void setReferences(boolean references) { this.references = references; }

        public boolean isCitations() { return citations; }
        public void setCitations(boolean citations) { this.citations = citations; }

        public boolean isPdf() { return pdf; }
        public void setPdf(boolean pdf) { this.pdf = pdf; }

        public boolean isBibtex() { return bibtex; }
        public void setBibtex(boolean bibtex) { this.bibtex = bibtex; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public SourceCapabilities toCapabilities() {
            return new SourceCapabilities(references, citations, pdf, bibtex);
        }
    }
}
