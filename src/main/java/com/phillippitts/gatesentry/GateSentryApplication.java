package com.phillippitts.gatesentry;

import com.phillippitts.gatesentry.config.properties.BridgeProperties;
import com.phillippitts.gatesentry.config.properties.ConversationProperties;
import com.phillippitts.gatesentry.config.properties.DirectoryProperties;
import com.phillippitts.gatesentry.config.properties.LlmProperties;
import com.phillippitts.gatesentry.config.properties.ThreadPoolProperties;
import com.phillippitts.gatesentry.config.properties.VisionLogProperties;
import com.phillippitts.gatesentry.config.properties.VisionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ConversationProperties.class,
        VisionProperties.class,
        BridgeProperties.class,
        LlmProperties.class,
        DirectoryProperties.class,
        VisionLogProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class GateSentryApplication {

    public static void main(String[] args) {
        SpringApplication.run(GateSentryApplication.class, args);
    }

}
