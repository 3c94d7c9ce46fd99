package com.behaviourmonitor.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A monitored entity: a user, an employee, a device or a tracked person.
 *
 * <p>
 * Rules can be restricted to subject types and monitoring profiles, and a
 * subject's {@code channels} receive every alert raised for it in addition to
 * the rule's own channels.
 * </p>
 *
 * @since 1.0.0
 */
public class Subject implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_PROFILE = "default";

    private String id;

    /** Free-form subject type, e.g. "user", "employee", "device". */
    private String type;

    private String profile = DEFAULT_PROFILE;

    private List<String> channels = new ArrayList<>();

    /** No-arg constructor required by SnakeYAML. */
    public Subject() {
    }

    public Subject(String id, String type, String profile, List<String> channels) {
        setId(id);
        setType(type);
        setProfile(profile);
        setChannels(channels);
    }

    /**
     * @throws IllegalStateException if the id is missing
     */
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalStateException("Subject 'id' is required");
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id != null ? id.trim() : null;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getProfile() {
        return profile;
    }

    public void setProfile(String profile) {
        this.profile = (profile == null || profile.isBlank()) ? DEFAULT_PROFILE : profile;
    }

    public List<String> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    public void setChannels(List<String> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Subject that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Subject{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", profile='" + profile + '\'' +
                ", channels=" + channels +
                '}';
    }
}
