package com.phillippitts.gatesentry.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static directories loaded once at startup: internal contacts and employee door permissions.
 */
@Validated
@ConfigurationProperties(prefix = "gate.directory")
public class DirectoryProperties {

    /** Contact name to e-mail address. Iteration order is the order shown to visitors. */
    private Map<String, String> contacts = new LinkedHashMap<>();

    /** Spring resource location of the employee JSON array. */
    @NotBlank
    private String employeesLocation = "classpath:employees.json";

    public Map<String, String> getContacts() {
        return contacts;
    }

    public void setContacts(Map<String, String> contacts) {
        this.contacts = contacts;
    }

    public String getEmployeesLocation() {
        return employeesLocation;
    }

    public void setEmployeesLocation(String employeesLocation) {
        this.employeesLocation = employeesLocation;
    }
}
