package com.eventdaemon.unit.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.eventdaemon.config.LogFileLocationValidator;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

class LogFileLocationValidatorTest {

    @TempDir
    Path logDir;

    private final LogFileLocationValidator validator = new LogFileLocationValidator();

    @Test
    @DisplayName("no log file configured passes")
    void noLogFile() {
        assertThatCode(() -> validator.postProcessEnvironment(new MockEnvironment(), null))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("a log file in an existing directory passes")
    void existingDirectory() {
        MockEnvironment environment =
                new MockEnvironment().withProperty("logging.file.name", logDir.resolve("daemon.log").toString());

        assertThatCode(() -> validator.postProcessEnvironment(environment, null)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("a log file in a missing directory fails startup")
    void missingDirectory() {
        Path missing = logDir.resolve("missing");
        MockEnvironment environment =
                new MockEnvironment().withProperty("logging.file.name", missing.resolve("daemon.log").toString());

        assertThatThrownBy(() -> validator.postProcessEnvironment(environment, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(missing.toString());
    }
}
