package com.eventdaemon.config;

import com.eventdaemon.core.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.io.File;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Daemon behaviour, bound from {@code daemon.*}. */
@Configuration
@ConfigurationProperties(prefix = "daemon")
@Validated
@Getter
@Setter
public class DaemonConfig {

    /** Handler search paths, separated by the platform path separator. */
    private String handlers = "";

    /** Extra class path entries for compiling handler sources. */
    private String handlerClasspath = "";

    /** Mirror every event emission onto named signal channels. */
    private boolean bridgeEnabled = false;

    /** Run the daemon when the application starts. */
    private boolean autoStart = true;

    @Valid
    private Handler handler = new Handler();

    public List<String> getSearchPaths() {
        return split(handlers);
    }

    public List<String> getHandlerClasspathEntries() {
        return split(handlerClasspath);
    }

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(
                handler.getMaxRetries(), Duration.ofMillis(Math.round(handler.getRetryDelay() * 1000)));
    }

    private static List<String> split(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(File.pathSeparator))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    @Getter
    @Setter
    public static class Handler {

        /** Reconnect and resume the event loop when it ends without a stop request. */
        private boolean autoReconnect = true;

        @Min(0)
        @Max(RetryPolicy.MAX_RETRIES)
        private int maxRetries = 3;

        /** Delay between connection attempts in seconds. */
        @Positive
        private double retryDelay = 1.0;
    }
}
