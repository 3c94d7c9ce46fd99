package com.behaviourmonitor.core.engine;

import com.behaviourmonitor.core.model.Subject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SubjectRegistry}.
 */
class SubjectRegistryTest {

    @Test
    @DisplayName("Re-registering a subject should replace it and return the previous one")
    void shouldReplaceOnProfileChange() {
        SubjectRegistry registry = new SubjectRegistry();

        assertThat(registry.register(new Subject("p1", "person", null, List.of()))).isEmpty();
        assertThat(registry.register(new Subject("p1", "person", "elderly-care", List.of())))
                .get().extracting(Subject::getProfile).isEqualTo("default");
        assertThat(registry.find("p1")).get().extracting(Subject::getProfile).isEqualTo("elderly-care");
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject subjects without an id")
    void shouldRejectMissingId() {
        assertThatThrownBy(() -> new SubjectRegistry().register(new Subject(" ", null, null, null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'id' is required");
    }

    @Test
    @DisplayName("Should remove subjects")
    void shouldRemove() {
        SubjectRegistry registry = new SubjectRegistry(List.of(new Subject("a", null, null, null)));

        assertThat(registry.remove("a")).isPresent();
        assertThat(registry.find("a")).isEmpty();
        assertThat(registry.all()).isEmpty();
    }
}
