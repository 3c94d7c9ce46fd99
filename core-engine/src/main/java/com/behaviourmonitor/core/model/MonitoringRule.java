package com.behaviourmonitor.core.model;

import com.behaviourmonitor.core.window.Comparison;
import com.behaviourmonitor.core.window.TriggerExpression;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes a single monitoring rule loaded from configuration.
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code rate} - more than {@code threshold} matching events per subject
 * within {@code windowSeconds}</li>
 * <li>{@code threshold} - numeric field compared against a static
 * threshold</li>
 * <li>{@code statistical} - outlier against a moving average</li>
 * <li>{@code window} - a trigger expression such as {@code avg(hr) > 120}
 * over a sliding time window</li>
 * <li>{@code consecutive} - a condition holding for N events in a row</li>
 * <li>{@code inactivity} - no activity for longer than the window</li>
 * <li>{@code dwell} - an attribute staying at one value (e.g. a zone) for
 * longer than the window</li>
 * </ul>
 *
 * <p>
 * The filter lists {@code eventTypes}, {@code subjectTypes} and
 * {@code profiles} restrict which events and subjects the rule sees. An empty
 * list matches everything.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared rule type are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringRule implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String TYPE_RATE = "rate";
    public static final String TYPE_THRESHOLD = "threshold";
    public static final String TYPE_STATISTICAL = "statistical";
    public static final String TYPE_WINDOW = "window";
    public static final String TYPE_CONSECUTIVE = "consecutive";
    public static final String TYPE_INACTIVITY = "inactivity";
    public static final String TYPE_DWELL = "dwell";

    /** Unique rule name used in alerts and metrics. */
    private String name;

    private String type;

    private String description;

    private boolean enabled = true;

    private String severity = "medium";

    /** Free-form action label carried on alerts, e.g. "notify_supervisor". */
    private String action;

    private List<String> channels = new ArrayList<>();

    /** Minimum seconds between two alerts per subject; {@code null} uses the engine default. */
    private Integer cooldownSeconds;

    // --- Filters ---
    private List<String> eventTypes = new ArrayList<>();
    private List<String> subjectTypes = new ArrayList<>();
    private List<String> profiles = new ArrayList<>();

    // --- Trigger parameters ---
    /** Size of the sliding time window in seconds. */
    private int windowSeconds;

    /** Event attribute whose value is evaluated. */
    private String field;

    /** Threshold value, semantics depend on the rule type. */
    private double threshold;

    /** Comparison operator for threshold and consecutive rules. */
    private String operator = ">";

    /** Trigger expression for window rules. */
    private String trigger;

    /** Number of recent values kept for the moving average. */
    private int windowSize = 10;

    /** Standard deviations for outlier detection; {@code null} uses the engine default. */
    private Double deviationFactor;

    /** Events in a row required by consecutive rules. */
    private int consecutive = 5;

    /** Attribute value watched by dwell rules. */
    private String value;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared rule type are present
     * and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Rule 'type' is required");
        }
        try {
            Severity.fromString(severity);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + name + "': " + e.getMessage());
        }
        if (cooldownSeconds != null && cooldownSeconds < 0) {
            errors.add("Rule '" + name + "' requires 'cooldownSeconds' >= 0");
        }

        if (type != null) {
            switch (type) {
                case TYPE_RATE -> {
                    requireWindow(errors, "Rate");
                    if (threshold <= 0) {
                        errors.add("Rate rule '" + name + "' requires 'threshold' > 0");
                    }
                }
                case TYPE_THRESHOLD -> {
                    requireField(errors, "Threshold");
                    requireOperator(errors, "Threshold");
                }
                case TYPE_STATISTICAL -> {
                    requireField(errors, "Statistical");
                    if (windowSize < 2) {
                        errors.add("Statistical rule '" + name + "' requires 'windowSize' >= 2");
                    }
                    if (deviationFactor != null && deviationFactor <= 0) {
                        errors.add("Statistical rule '" + name + "' requires 'deviationFactor' > 0");
                    }
                }
                case TYPE_WINDOW -> {
                    requireWindow(errors, "Window");
                    if (trigger == null || trigger.isBlank()) {
                        errors.add("Window rule '" + name + "' requires 'trigger'");
                    } else {
                        try {
                            TriggerExpression.parse(trigger);
                        } catch (IllegalArgumentException e) {
                            errors.add("Window rule '" + name + "': " + e.getMessage());
                        }
                    }
                }
                case TYPE_CONSECUTIVE -> {
                    requireField(errors, "Consecutive");
                    requireOperator(errors, "Consecutive");
                    if (consecutive < 1) {
                        errors.add("Consecutive rule '" + name + "' requires 'consecutive' >= 1");
                    }
                }
                case TYPE_INACTIVITY -> requireWindow(errors, "Inactivity");
                case TYPE_DWELL -> {
                    requireField(errors, "Dwell");
                    requireWindow(errors, "Dwell");
                    if (value == null || value.isBlank()) {
                        errors.add("Dwell rule '" + name + "' requires 'value'");
                    }
                }
                default -> errors.add("Unknown rule type: '" + type
                        + "'. Supported: rate, threshold, statistical, window, consecutive, inactivity, dwell");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid MonitoringRule: " + String.join("; ", errors));
        }
    }

    private void requireField(List<String> errors, String label) {
        if (field == null || field.isBlank()) {
            errors.add(label + " rule '" + name + "' requires 'field'");
        }
    }

    private void requireWindow(List<String> errors, String label) {
        if (windowSeconds <= 0) {
            errors.add(label + " rule '" + name + "' requires 'windowSeconds' > 0");
        }
    }

    private void requireOperator(List<String> errors, String label) {
        try {
            Comparison.parse(operator);
        } catch (IllegalArgumentException e) {
            errors.add(label + " rule '" + name + "': " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Filters
    // ---------------------------------------------------------------

    /**
     * @param eventType normalised event type
     * @return {@code true} if this rule evaluates events of the given type
     */
    public boolean matchesEventType(String eventType) {
        return eventTypes.isEmpty() || eventTypes.contains(eventType);
    }

    /**
     * Check the subject filters. An unregistered subject ({@code null}) has
     * no type and the default profile.
     *
     * @param subject registered subject, may be {@code null}
     * @return {@code true} if this rule applies to the subject
     */
    public boolean matchesSubject(Subject subject) {
        String subjectType = subject != null ? subject.getType() : null;
        String profile = subject != null ? subject.getProfile() : Subject.DEFAULT_PROFILE;
        boolean typeOk = subjectTypes.isEmpty()
                || (subjectType != null && subjectTypes.contains(subjectType));
        boolean profileOk = profiles.isEmpty() || profiles.contains(profile);
        return typeOk && profileOk;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     *
     * @param type rule type string
     */
    public void setType(String type) {
        this.type = type != null ? type.trim().toLowerCase(Locale.ROOT) : null;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public Severity severityLevel() {
        return Severity.fromString(severity);
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public List<String> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    public void setChannels(List<String> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    public Integer getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(Integer cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    public List<String> getEventTypes() {
        return Collections.unmodifiableList(eventTypes);
    }

    /**
     * Set the event-type filter, normalised to lowercase like intake does.
     *
     * @param eventTypes event types this rule evaluates
     */
    public void setEventTypes(List<String> eventTypes) {
        this.eventTypes = new ArrayList<>();
        if (eventTypes != null) {
            eventTypes.stream()
                    .filter(Objects::nonNull)
                    .map(t -> t.trim().toLowerCase(Locale.ROOT))
                    .forEach(this.eventTypes::add);
        }
    }

    public List<String> getSubjectTypes() {
        return Collections.unmodifiableList(subjectTypes);
    }

    public void setSubjectTypes(List<String> subjectTypes) {
        this.subjectTypes = subjectTypes != null ? new ArrayList<>(subjectTypes) : new ArrayList<>();
    }

    public List<String> getProfiles() {
        return Collections.unmodifiableList(profiles);
    }

    public void setProfiles(List<String> profiles) {
        this.profiles = profiles != null ? new ArrayList<>(profiles) : new ArrayList<>();
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public String getTrigger() {
        return trigger;
    }

    public void setTrigger(String trigger) {
        this.trigger = trigger;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public Double getDeviationFactor() {
        return deviationFactor;
    }

    public void setDeviationFactor(Double deviationFactor) {
        this.deviationFactor = deviationFactor;
    }

    public int getConsecutive() {
        return consecutive;
    }

    public void setConsecutive(int consecutive) {
        this.consecutive = consecutive;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MonitoringRule that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "MonitoringRule{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", severity='" + severity + '\'' +
                ", field='" + field + '\'' +
                ", operator='" + operator + '\'' +
                ", threshold=" + threshold +
                ", trigger='" + trigger + '\'' +
                ", windowSeconds=" + windowSeconds +
                ", cooldownSeconds=" + cooldownSeconds +
                ", enabled=" + enabled +
                '}';
    }
}
