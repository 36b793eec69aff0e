package com.phillippitts.gatesentry.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Location and retention of the per-session vision log.
 */
@Validated
@ConfigurationProperties(prefix = "gate.vision-log")
public class VisionLogProperties {

    @NotBlank
    private String directory = "data/logs";

    /** Entries retained per session; older entries are discarded on append. */
    @Min(1)
    private int maxEntries = 50;

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }
}
