package com.phillippitts.gatesentry.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the vision debounce pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "gate.vision")
public class VisionProperties {

    /** Starts the frame consumer thread. */
    private boolean enabled = true;

    @Min(1)
    private int frameQueueCapacity = 10;

    /** Size of the per-session face-presence window (K). */
    @Min(3)
    @Max(4)
    private int windowSize = 4;

    @NotNull
    private Duration escalationCooldown = Duration.ofSeconds(10);

    /** Sleep between consumer cycles when the frame queue is empty. */
    @NotNull
    private Duration idlePollInterval = Duration.ofMillis(100);

    @Valid
    private Capture capture = new Capture();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getFrameQueueCapacity() {
        return frameQueueCapacity;
    }

    public void setFrameQueueCapacity(int frameQueueCapacity) {
        this.frameQueueCapacity = frameQueueCapacity;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public Duration getEscalationCooldown() {
        return escalationCooldown;
    }

    public void setEscalationCooldown(Duration escalationCooldown) {
        this.escalationCooldown = escalationCooldown;
    }

    public Duration getIdlePollInterval() {
        return idlePollInterval;
    }

    public void setIdlePollInterval(Duration idlePollInterval) {
        this.idlePollInterval = idlePollInterval;
    }

    public Capture getCapture() {
        return capture;
    }

    public void setCapture(Capture capture) {
        this.capture = capture;
    }

    /**
     * Timer-driven frame capture for camera-bound sessions from snapshot files
     * ({@code <directory>/<cameraId>.jpg} or {@code .png}).
     */
    public static class Capture {
        private boolean enabled = false;

        /** Delay between capture rounds in milliseconds. */
        @Min(100)
        private long intervalMs = 2000;

        @NotBlank
        private String directory = "data/cameras";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }
}
