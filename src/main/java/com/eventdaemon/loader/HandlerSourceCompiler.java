package com.eventdaemon.loader;

import com.eventdaemon.exception.HandlerLoadException;
import com.eventdaemon.registry.HandlerModule;
import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a single handler source file into a class output directory. The compile classpath
 * holds the daemon's own API, SLF4J, the JVM classpath and any configured extra entries.
 */
class HandlerSourceCompiler {

    private static final Logger log = LoggerFactory.getLogger(HandlerSourceCompiler.class);

    private final String classpath;

    HandlerSourceCompiler(List<String> extraClasspath) {
        this.classpath = buildClasspath(extraClasspath);
    }

    String getClasspath() {
        return classpath;
    }

    void compile(Path source, Path outputDir) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new HandlerLoadException(
                    source, "No system Java compiler available; handler sources require a JDK runtime");
        }

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager fileManager =
                compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            Iterable<? extends JavaFileObject> units = fileManager.getJavaFileObjects(source.toFile());
            List<String> options =
                    List.of("-d", outputDir.toString(), "-classpath", classpath, "-proc:none");
            Boolean compiled = compiler.getTask(null, fileManager, diagnostics, options, null, units)
                    .call();
            if (!Boolean.TRUE.equals(compiled)) {
                throw new HandlerLoadException(source, "Compilation failed: " + describe(diagnostics));
            }
        } catch (IOException e) {
            throw new HandlerLoadException(source, "Compilation failed: " + e.getMessage(), e);
        }
        log.debug("Compiled {} into {}", source, outputDir);
    }

    private static String describe(DiagnosticCollector<JavaFileObject> diagnostics) {
        return diagnostics.getDiagnostics().stream()
                .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                .map(d -> "line " + d.getLineNumber() + ": " + d.getMessage(Locale.ROOT))
                .collect(Collectors.joining("; "));
    }

    private static String buildClasspath(List<String> extraClasspath) {
        Set<String> entries = new LinkedHashSet<>();
        addCodeSource(entries, HandlerModule.class);
        addCodeSource(entries, Logger.class);
        String jvmClasspath = System.getProperty("java.class.path", "");
        for (String entry : jvmClasspath.split(File.pathSeparator)) {
            if (!entry.isBlank()) {
                entries.add(entry);
            }
        }
        for (String entry : extraClasspath) {
            if (!entry.isBlank()) {
                entries.add(entry.trim());
            }
        }
        return String.join(File.pathSeparator, entries);
    }

    private static void addCodeSource(Set<String> entries, Class<?> type) {
        CodeSource codeSource = type.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return;
        }
        URL location = codeSource.getLocation();
        try {
            entries.add(Path.of(location.toURI()).toString());
        } catch (URISyntaxException | IllegalArgumentException | FileSystemNotFoundException e) {
            // Nested jar locations cannot be handed to javac; daemon.handler-classpath covers them
            log.debug("Skipping non-file classpath location {}: {}", location, e.getMessage());
        }
    }
}
