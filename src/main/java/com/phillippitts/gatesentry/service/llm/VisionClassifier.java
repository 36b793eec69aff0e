package com.phillippitts.gatesentry.service.llm;

/**
 * Image-classification capability used by the vision pipeline.
 */
public interface VisionClassifier {

    /**
     * Classifies one frame.
     *
     * @param image    encoded image bytes
     * @param mimeType image media type, e.g. {@code image/jpeg}
     * @return raw model answer expected to contain a vision JSON object
     * @throws com.phillippitts.gatesentry.exception.CapabilityException on failure
     */
    String classify(byte[] image, String mimeType);
}
