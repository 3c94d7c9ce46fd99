package com.behaviourmonitor.flink;

import com.behaviourmonitor.core.config.EngineSettings;
import com.behaviourmonitor.core.intake.EventIntake;
import com.behaviourmonitor.core.intake.EventValidationException;
import com.behaviourmonitor.core.model.Event;
import com.behaviourmonitor.core.model.RawEvent;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;

/**
 * Flink {@link DeserializationSchema} that turns raw Kafka bytes into
 * validated {@link Event}s via {@link EventIntake}.
 * <p>
 * Malformed JSON and events rejected by intake are logged and dropped
 * (returns {@code null}), so a single bad record does not crash the
 * pipeline.
 * </p>
 */
public class EventDeserializationSchema implements DeserializationSchema<Event> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(EventDeserializationSchema.class);

    private final EventIntake intake;

    private transient ObjectMapper mapper;

    public EventDeserializationSchema(EngineSettings settings) {
        this.intake = new EventIntake(Objects.requireNonNull(settings, "EngineSettings must not be null"));
    }

    @Override
    public Event deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        RawEvent raw;
        try {
            raw = objectMapper().readValue(message, RawEvent.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize event - skipping: {}", e.getMessage());
            return null;
        }
        try {
            return intake.normalize(raw, Instant.now());
        } catch (EventValidationException e) {
            LOG.warn("Rejected event - skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(Event nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<Event> getProducedType() {
        return TypeInformation.of(Event.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
