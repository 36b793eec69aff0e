package com.phillippitts.gatesentry.config;

import com.phillippitts.gatesentry.config.properties.VisionProperties;
import com.phillippitts.gatesentry.service.vision.FrameSource;
import com.phillippitts.gatesentry.service.vision.SnapshotFileFrameSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Beans for the vision pipeline that have no natural component home.
 */
@Configuration
public class VisionConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(FrameSource.class)
    public FrameSource frameSource(VisionProperties props) {
        return new SnapshotFileFrameSource(Paths.get(props.getCapture().getDirectory()));
    }
}
