package com.phillippitts.gatesentry.config;

import com.phillippitts.gatesentry.config.properties.DirectoryProperties;
import com.phillippitts.gatesentry.service.directory.ContactDirectory;
import com.phillippitts.gatesentry.service.directory.EmployeeDirectory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads the contact and employee directories once at startup.
 */
@Configuration
public class DirectoryConfig {

    private static final Logger LOG = LogManager.getLogger(DirectoryConfig.class);

    @Bean
    public ContactDirectory contactDirectory(DirectoryProperties props) {
        ContactDirectory directory = new ContactDirectory(props.getContacts());
        if (directory.size() == 0) {
            LOG.warn("Contact directory is empty; visitors will never complete intake (gate.directory.contacts)");
        } else {
            LOG.info("Contact directory loaded: {} contacts", directory.size());
        }
        return directory;
    }

    /**
     * Missing employee file is tolerated (no one authenticates); a malformed one fails startup.
     */
    @Bean
    public EmployeeDirectory employeeDirectory(DirectoryProperties props, ResourceLoader resourceLoader)
            throws IOException {
        Resource resource = resourceLoader.getResource(props.getEmployeesLocation());
        if (!resource.exists()) {
            LOG.warn("Employee directory not found at {}; authentication disabled", props.getEmployeesLocation());
            return EmployeeDirectory.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            EmployeeDirectory directory = EmployeeDirectory.fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            LOG.info("Employee directory loaded: {} employees from {}", directory.size(), props.getEmployeesLocation());
            return directory;
        }
    }
}
