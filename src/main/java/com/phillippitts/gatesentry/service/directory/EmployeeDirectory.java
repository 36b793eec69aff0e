package com.phillippitts.gatesentry.service.directory;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only employee directory used for name-based authentication and door authorization.
 *
 * <p>Source format is a JSON array:
 * <pre>
 * [{"name": "Jane Doe", "greeting": "Hi Jane!", "permissions": {"doors": ["cam-1"]}}]
 * </pre>
 */
public final class EmployeeDirectory {

    private final Map<String, Employee> byName;

    public EmployeeDirectory(List<Employee> employees) {
        Map<String, Employee> map = new LinkedHashMap<>();
        for (Employee e : employees) {
            map.put(e.name(), e);
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    public static EmployeeDirectory empty() {
        return new EmployeeDirectory(List.of());
    }

    /**
     * Parses the JSON array format described on the class.
     *
     * @throws IllegalArgumentException if the document is not a JSON array of objects with a name
     */
    public static EmployeeDirectory fromJson(String json) {
        try {
            JSONArray arr = new JSONArray(json);
            List<Employee> employees = new ArrayList<>(arr.length());
            for (int i = 0; i < arr.length(); i++) {
                JSONObject obj = arr.getJSONObject(i);
                List<String> doors = new ArrayList<>();
                JSONObject permissions = obj.optJSONObject("permissions");
                JSONArray doorArr = permissions == null ? null : permissions.optJSONArray("doors");
                if (doorArr != null) {
                    for (int j = 0; j < doorArr.length(); j++) {
                        doors.add(doorArr.getString(j));
                    }
                }
                employees.add(new Employee(obj.getString("name"), obj.optString("greeting", null), doors));
            }
            return new EmployeeDirectory(employees);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed employee directory: " + e.getMessage(), e);
        }
    }

    /** True if an employee with exactly this name exists. */
    public boolean authenticate(String name) {
        return name != null && byName.containsKey(name);
    }

    public Optional<Employee> find(String name) {
        return Optional.ofNullable(name == null ? null : byName.get(name));
    }

    /** True if the named employee may open the door bound to {@code cameraId}. */
    public boolean isAuthorized(String name, String cameraId) {
        return find(name).map(e -> e.mayOpen(cameraId)).orElse(false);
    }

    public int size() {
        return byName.size();
    }
}
