package fr.lapetina.ocr.scheduler.security;

import fr.lapetina.ocr.scheduler.domain.exception.PathViolationException;
import fr.lapetina.ocr.scheduler.domain.model.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathGuardTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("should accept only canonical UUID task ids")
    void shouldValidateTaskIds() {
        assertThat(PathGuard.isValidTaskId("0f8fad5b-d9cb-469f-a165-70867728950e")).isTrue();
        assertThat(PathGuard.isValidTaskId("../0f8fad5b")).isFalse();
        assertThat(PathGuard.isValidTaskId("1-1-1-1-1")).isFalse();
        assertThat(PathGuard.isValidTaskId(null)).isFalse();
    }

    @Test
    @DisplayName("should reject paths escaping the root")
    void shouldRejectEscapingPaths() {
        assertThat(PathGuard.requireUnder(root, root.resolve("a/../b.md"))).isEqualTo(root.resolve("b.md"));

        assertThatThrownBy(() -> PathGuard.requireUnder(root, root.resolve("../elsewhere/b.md")))
                .isInstanceOf(PathViolationException.class)
                .satisfies(e -> assertThat(((PathViolationException) e).getErrorType())
                        .isEqualTo(ErrorType.PATH_VIOLATION));
    }

    @Test
    @DisplayName("should reduce names to their last segment")
    void shouldReduceToBaseName() {
        assertThat(PathGuard.baseName("../../etc/img.png")).isEqualTo("img.png");
        assertThat(PathGuard.baseName("a\\b\\c.jpg")).isEqualTo("c.jpg");
        assertThat(PathGuard.baseName("dir/..")).isNull();
        assertThat(PathGuard.baseName("trailing/")).isNull();
    }
}
