package com.behaviourmonitor.core.engine;

import com.behaviourmonitor.core.model.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of known subjects, keyed by id.
 *
 * <p>
 * Subjects that were never registered can still send events; they are
 * treated as having no type and the default profile. This class is
 * thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class SubjectRegistry implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SubjectRegistry.class);

    private final ConcurrentHashMap<String, Subject> subjects = new ConcurrentHashMap<>();

    public SubjectRegistry() {
    }

    public SubjectRegistry(Collection<Subject> initial) {
        Objects.requireNonNull(initial, "Subjects must not be null");
        initial.forEach(this::register);
    }

    /**
     * Register a subject, replacing any previous registration with the same
     * id (a profile change).
     *
     * @param subject the subject; must pass {@link Subject#validate()}
     * @return the previous registration, if any
     * @throws IllegalStateException if the subject is invalid
     */
    public Optional<Subject> register(Subject subject) {
        Objects.requireNonNull(subject, "Subject must not be null");
        subject.validate();
        Subject previous = subjects.put(subject.getId(), subject);
        if (previous == null) {
            LOG.debug("Registered subject {}", subject.getId());
        } else {
            LOG.debug("Updated subject {}: profile {} -> {}", subject.getId(),
                    previous.getProfile(), subject.getProfile());
        }
        return Optional.ofNullable(previous);
    }

    public Optional<Subject> find(String subjectId) {
        return subjectId == null ? Optional.empty() : Optional.ofNullable(subjects.get(subjectId));
    }

    public Optional<Subject> remove(String subjectId) {
        return Optional.ofNullable(subjects.remove(subjectId));
    }

    public List<Subject> all() {
        return new ArrayList<>(subjects.values());
    }

    public int size() {
        return subjects.size();
    }
}
