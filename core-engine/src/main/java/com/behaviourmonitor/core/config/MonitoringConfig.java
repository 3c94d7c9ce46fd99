package com.behaviourmonitor.core.config;

import com.behaviourmonitor.core.model.MonitoringRule;
import com.behaviourmonitor.core.model.Subject;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the monitoring YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - name: burst_of_logins
 *     type: rate
 *     eventTypes: [login]
 *     windowSeconds: 60
 *     threshold: 5
 *     severity: high
 * subjects:
 *   - id: emp-42
 *     type: employee
 *     profile: strict
 *     channels: [security-desk]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every rule and subject.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<MonitoringRule> rules = new ArrayList<>();

    private List<Subject> subjects = new ArrayList<>();

    /**
     * @return unmodifiable list of rules
     */
    public List<MonitoringRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the monitoring rules
     */
    public void setRules(List<MonitoringRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of pre-registered subjects
     */
    public List<Subject> getSubjects() {
        return Collections.unmodifiableList(subjects);
    }

    public void setSubjects(List<Subject> subjects) {
        this.subjects = subjects != null ? new ArrayList<>(subjects) : new ArrayList<>();
    }

    /**
     * Validate every rule and subject in this configuration.
     *
     * <p>
     * Delegates to {@link MonitoringRule#validate()} and
     * {@link Subject#validate()}, additionally rejecting duplicate rule names
     * and duplicate subject ids.
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more entries are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            MonitoringRule rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getName() != null && !names.add(rule.getName())) {
                errors.add("Duplicate rule name: '" + rule.getName() + "'");
            }
        }

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < subjects.size(); i++) {
            Subject subject = Objects.requireNonNull(subjects.get(i),
                    "Subject at index " + i + " is null");
            try {
                subject.validate();
            } catch (IllegalStateException e) {
                errors.add("Subject at index " + i + ": " + e.getMessage());
            }
            if (subject.getId() != null && !ids.add(subject.getId())) {
                errors.add("Duplicate subject id: '" + subject.getId() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Monitoring configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "MonitoringConfig{rules=" + rules + ", subjects=" + subjects + '}';
    }
}
