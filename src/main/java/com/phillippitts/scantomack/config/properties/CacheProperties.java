package com.phillippitts.scantomack.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * In-memory result cache ({@code ocr.cache.*}). Disabled by default.
 */
@ConfigurationProperties(prefix = "ocr.cache")
public class CacheProperties {

    private boolean enabled = false;
    private int maxEntries = 256;
    private Duration ttl = Duration.ofHours(1);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }
}
