package com.phillippitts.gatesentry.service.directory;

import java.util.List;
import java.util.Objects;

/**
 * Employee entry with the doors (camera ids) the employee may open.
 *
 * @param name     full name, matched exactly
 * @param greeting personalized greeting spoken on authorized entry
 * @param doors    camera/door identifiers the employee is authorized for
 */
public record Employee(String name, String greeting, List<String> doors) {

    public Employee {
        Objects.requireNonNull(name, "name");
        greeting = greeting == null || greeting.isBlank() ? "Welcome back, " + name + "!" : greeting;
        doors = doors == null ? List.of() : List.copyOf(doors);
    }

    public boolean mayOpen(String cameraId) {
        return cameraId != null && doors.contains(cameraId);
    }
}
