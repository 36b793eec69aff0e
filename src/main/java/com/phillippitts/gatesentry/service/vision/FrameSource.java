package com.phillippitts.gatesentry.service.vision;

import java.util.Optional;

/** Supplies the current picture of a camera. */
public interface FrameSource {

    /**
     * Captures one frame.
     *
     * @return the frame, or empty if the camera has nothing to offer right now
     */
    Optional<CapturedImage> capture(String cameraId);
}
