package com.eventdaemon.config;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;

/**
 * Fails startup when {@code logging.file.name} ({@code IB_LOG_FILE}) points into a directory
 * that does not exist. Runs before the logging system starts, which would otherwise create
 * the directory.
 */
public class LogFileLocationValidator implements EnvironmentPostProcessor {

    static final String LOG_FILE_PROPERTY = "logging.file.name";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String logFile = environment.getProperty(LOG_FILE_PROPERTY);
        if (logFile == null || logFile.isBlank()) {
            return;
        }
        Path parent;
        try {
            parent = Path.of(logFile.trim()).toAbsolutePath().getParent();
        } catch (InvalidPathException e) {
            throw new IllegalStateException("Invalid log file path " + logFile + ": " + e.getMessage(), e);
        }
        if (parent != null && !Files.isDirectory(parent)) {
            throw new IllegalStateException("Log directory " + parent + " does not exist");
        }
    }
}
