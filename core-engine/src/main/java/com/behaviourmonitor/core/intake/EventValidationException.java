package com.behaviourmonitor.core.intake;

import java.util.List;

/**
 * Thrown by {@link EventIntake} when a raw event cannot be normalised.
 *
 * <p>
 * Carries every problem found in the event, not only the first one.
 * </p>
 *
 * @since 1.0.0
 */
public class EventValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public EventValidationException(List<String> errors) {
        super("Invalid event: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
