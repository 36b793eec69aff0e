package com.phillippitts.gatesentry.service.vision;

import com.phillippitts.gatesentry.config.properties.VisionProperties;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single consumer of the frame queue, running on the {@code visionExecutor} thread.
 *
 * <p>Each cycle drains the whole queue and keeps only the newest frame of each session; older frames
 * are discarded and counted. When the queue is empty the loop sleeps for
 * {@code gate.vision.idle-poll-interval}.
 */
@Service
public class VisionConsumer implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(VisionConsumer.class);

    private final FrameIntake intake;
    private final VisionPipeline pipeline;
    private final TaskExecutor executor;
    private final VisionProperties props;
    private final GateMetrics metrics;

    private volatile boolean running;

    public VisionConsumer(FrameIntake intake,
                          VisionPipeline pipeline,
                          @Qualifier("visionExecutor") TaskExecutor executor,
                          VisionProperties props,
                          GateMetrics metrics) {
        this.intake = intake;
        this.pipeline = pipeline;
        this.executor = executor;
        this.props = props;
        this.metrics = metrics;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        if (!props.isEnabled()) {
            LOG.info("Vision consumer disabled (gate.vision.enabled=false)");
            return;
        }
        running = true;
        executor.execute(this::loop);
        LOG.info("Vision consumer started (window={}, queue={})", props.getWindowSize(), props.getFrameQueueCapacity());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        LOG.info("Vision consumer stopped");
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Runs one consumer cycle.
     *
     * @return {@code true} if any frame was processed
     */
    public boolean drainOnce() {
        List<CapturedFrame> frames = intake.drainAll();
        if (frames.isEmpty()) {
            return false;
        }
        Map<String, CapturedFrame> latest = new LinkedHashMap<>();
        for (CapturedFrame frame : frames) {
            latest.remove(frame.sessionId());
            latest.put(frame.sessionId(), frame);
        }
        int superseded = frames.size() - latest.size();
        if (superseded > 0) {
            metrics.incrementFramesDropped("superseded", superseded);
            LOG.debug("Discarded {} superseded frames", superseded);
        }
        for (CapturedFrame frame : latest.values()) {
            pipeline.process(frame);
        }
        return true;
    }

    private void loop() {
        long idleMillis = props.getIdlePollInterval().toMillis();
        while (running) {
            try {
                if (!drainOnce()) {
                    Thread.sleep(idleMillis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.info("Vision consumer interrupted; exiting");
                running = false;
            } catch (RuntimeException e) {
                LOG.error("Vision consumer cycle failed", e);
            }
        }
    }
}
