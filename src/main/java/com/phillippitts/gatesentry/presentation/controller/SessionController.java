package com.phillippitts.gatesentry.presentation.controller;

import com.phillippitts.gatesentry.exception.SessionNotFoundException;
import com.phillippitts.gatesentry.presentation.dto.CameraRequest;
import com.phillippitts.gatesentry.presentation.dto.EventResponse;
import com.phillippitts.gatesentry.presentation.dto.ImageAcceptedResponse;
import com.phillippitts.gatesentry.presentation.dto.ImageRequest;
import com.phillippitts.gatesentry.presentation.dto.MessageRequest;
import com.phillippitts.gatesentry.presentation.dto.MessageResponse;
import com.phillippitts.gatesentry.presentation.dto.ProfileResponse;
import com.phillippitts.gatesentry.presentation.dto.SessionCreatedResponse;
import com.phillippitts.gatesentry.presentation.dto.StartSessionRequest;
import com.phillippitts.gatesentry.presentation.dto.ThreatLogResponse;
import com.phillippitts.gatesentry.service.conversation.GateConversationService;
import com.phillippitts.gatesentry.service.events.SessionOutbox;
import com.phillippitts.gatesentry.service.log.VisionLogStore;
import com.phillippitts.gatesentry.service.vision.FrameIntake;
import com.phillippitts.gatesentry.util.LogSanitizer;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Session API: conversation turns, camera frames, and polling for gate events.
 *
 * <p>Domain exceptions are translated by {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/sessions")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final GateConversationService conversations;
    private final FrameIntake frames;
    private final SessionOutbox outbox;
    private final VisionLogStore visionLog;

    SessionController(GateConversationService conversations,
                      FrameIntake frames,
                      SessionOutbox outbox,
                      VisionLogStore visionLog) {
        this.conversations = conversations;
        this.frames = frames;
        this.outbox = outbox;
        this.visionLog = visionLog;
    }

    @PostMapping
    ResponseEntity<SessionCreatedResponse> start(@RequestBody(required = false) StartSessionRequest request) {
        String cameraId = request == null ? null : request.cameraId();
        String sessionId = conversations.startSession(cameraId);
        return ResponseEntity.status(HttpStatus.CREATED).body(new SessionCreatedResponse(sessionId));
    }

    @PostMapping("/{sessionId}/messages")
    MessageResponse message(@PathVariable String sessionId, @RequestBody MessageRequest request) {
        LOG.debug("Message for session {}: {}", sessionId, LogSanitizer.preview(request.messageOrEmpty()));
        return MessageResponse.from(conversations.handleTurn(sessionId, request.messageOrEmpty()));
    }

    @GetMapping("/{sessionId}/profile")
    ProfileResponse profile(@PathVariable String sessionId) {
        return ProfileResponse.from(conversations.profile(sessionId));
    }

    @PostMapping("/{sessionId}/images")
    ResponseEntity<ImageAcceptedResponse> image(@PathVariable String sessionId,
                                                @Valid @RequestBody ImageRequest request) {
        String imageId = frames.submitBase64(sessionId, request.image(), request.mimeType());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ImageAcceptedResponse.queued(imageId));
    }

    @PutMapping("/{sessionId}/camera")
    ResponseEntity<Void> camera(@PathVariable String sessionId, @Valid @RequestBody CameraRequest request) {
        conversations.bindCamera(sessionId, request.cameraId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{sessionId}/events")
    List<EventResponse> events(@PathVariable String sessionId) {
        requireSession(sessionId);
        return outbox.drain(sessionId).stream().map(EventResponse::from).toList();
    }

    @GetMapping("/{sessionId}/threat-logs")
    List<ThreatLogResponse> threatLogs(@PathVariable String sessionId) {
        requireSession(sessionId);
        return visionLog.entries(sessionId).stream().map(ThreatLogResponse::from).toList();
    }

    @DeleteMapping("/{sessionId}")
    ResponseEntity<Void> end(@PathVariable String sessionId) {
        conversations.endSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    private void requireSession(String sessionId) {
        if (!conversations.exists(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
    }
}
