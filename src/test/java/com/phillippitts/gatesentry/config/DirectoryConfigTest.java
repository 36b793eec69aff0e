package com.phillippitts.gatesentry.config;

import com.phillippitts.gatesentry.config.properties.DirectoryProperties;
import com.phillippitts.gatesentry.service.directory.EmployeeDirectory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryConfigTest {

    private final DirectoryConfig config = new DirectoryConfig();

    @TempDir
    Path dir;

    @Test
    void loadsBundledEmployees() throws IOException {
        DirectoryProperties props = new DirectoryProperties();
        props.setEmployeesLocation("classpath:employees.json");

        EmployeeDirectory employees = config.employeeDirectory(props, new DefaultResourceLoader());

        assertThat(employees.size()).isEqualTo(3);
        assertThat(employees.isAuthorized("Alice Kimble", "lab-door")).isTrue();
        assertThat(employees.isAuthorized("Michael Chen", "lab-door")).isFalse();
    }

    @Test
    void missingEmployeeFileDisablesAuthentication() throws IOException {
        DirectoryProperties props = new DirectoryProperties();
        props.setEmployeesLocation("file:" + dir.resolve("absent.json"));

        assertThat(config.employeeDirectory(props, new DefaultResourceLoader()).size()).isZero();
    }

    @Test
    void malformedEmployeeFileFailsStartup() throws IOException {
        Path file = Files.writeString(dir.resolve("employees.json"), "[{\"greeting\": 42");
        DirectoryProperties props = new DirectoryProperties();
        props.setEmployeesLocation("file:" + file);

        assertThatThrownBy(() -> config.employeeDirectory(props, new DefaultResourceLoader()))
                .isInstanceOf(RuntimeException.class);
    }
}
