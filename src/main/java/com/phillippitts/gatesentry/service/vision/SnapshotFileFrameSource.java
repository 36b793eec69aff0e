package com.phillippitts.gatesentry.service.vision;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the latest snapshot a camera wrote to disk: {@code <directory>/<cameraId>.jpg} or {@code .png}.
 *
 * <p>Suits cameras and capture daemons that periodically overwrite a snapshot file.
 */
public final class SnapshotFileFrameSource implements FrameSource {

    private static final Logger LOG = LogManager.getLogger(SnapshotFileFrameSource.class);

    private static final Map<String, String> EXTENSIONS = Map.of(
            ".jpg", "image/jpeg",
            ".png", "image/png");

    private final Path directory;

    public SnapshotFileFrameSource(Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<CapturedImage> capture(String cameraId) {
        if (cameraId == null || cameraId.contains("/") || cameraId.contains("\\") || cameraId.contains("..")) {
            LOG.warn("Refusing snapshot path for camera id '{}'", cameraId);
            return Optional.empty();
        }
        for (Map.Entry<String, String> ext : EXTENSIONS.entrySet()) {
            Path file = directory.resolve(cameraId + ext.getKey());
            if (Files.isRegularFile(file)) {
                try {
                    return Optional.of(new CapturedImage(Files.readAllBytes(file), ext.getValue()));
                } catch (IOException e) {
                    LOG.warn("Could not read snapshot {}: {}", file, e.getMessage());
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }
}
