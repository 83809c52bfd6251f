package com.eventdaemon.loader;

import com.eventdaemon.exception.HandlerLoadException;
import com.eventdaemon.registry.HandlerModule;
import com.eventdaemon.registry.OnEvent;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads handler code from the configured search paths.
 *
 * <p>A search path is either a directory, walked recursively for {@code .java} and
 * {@code .jar} files that are loaded in path order, or a single such file. {@code package-info.java} and
 * {@code module-info.java} are skipped. Each file is loaded in its own class loader and
 * yields a {@link LoadResult}; a file that fails to compile or initialize does not stop the
 * others.
 *
 * <p>Source files are compiled and every top-level class in them is initialized. Classes that
 * implement {@link HandlerModule} or declare {@link OnEvent} methods are instantiated through
 * their public no-argument constructor. Archives list their handler classes in
 * {@code META-INF/services/com.eventdaemon.registry.HandlerModule}.
 *
 * <p>Class loaders and compiled output of the previous pass are released when the next pass
 * starts and on {@link #close()}.
 */
public class HandlerLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HandlerLoader.class);

    static final String SERVICE_ENTRY = "META-INF/services/" + HandlerModule.class.getName();

    private static final Set<String> MARKER_SOURCES = Set.of("package-info.java", "module-info.java");

    private final HandlerSourceCompiler compiler;
    private final ClassLoader parentLoader;
    private final List<URLClassLoader> openLoaders = new ArrayList<>();
    private final List<Path> outputDirs = new ArrayList<>();

    public HandlerLoader(List<String> extraClasspath) {
        this.compiler = new HandlerSourceCompiler(extraClasspath);
        this.parentLoader = HandlerModule.class.getClassLoader();
    }

    /**
     * Loads every handler file reachable from {@code searchPaths}. Missing paths are skipped
     * with a warning. Returns one result per file, in load order.
     */
    public synchronized List<LoadResult> discover(List<String> searchPaths) {
        release();
        if (searchPaths.isEmpty()) {
            log.warn("No handler search paths configured");
            return List.of();
        }

        List<Path> candidates = new ArrayList<>();
        for (String searchPath : searchPaths) {
            candidates.addAll(resolve(searchPath));
        }

        List<LoadResult> results = new ArrayList<>(candidates.size());
        for (Path candidate : candidates) {
            results.add(load(candidate));
        }
        log.info("Handler discovery visited {} file(s) in {} search path(s)", results.size(), searchPaths.size());
        return results;
    }

    /** Loads one {@code .java} or {@code .jar} file. Never throws; failures are captured. */
    public synchronized LoadResult load(Path file) {
        try {
            List<Object> modules = isArchive(file) ? loadArchive(file) : loadSource(file);
            log.debug("Loaded {} handler instance(s) from {}", modules.size(), file);
            return LoadResult.success(file, modules);
        } catch (HandlerLoadException e) {
            return LoadResult.failure(file, e);
        } catch (RuntimeException | LinkageError e) {
            return LoadResult.failure(
                    file, new HandlerLoadException(file, "Failed to load " + file + ": " + e, e));
        }
    }

    public synchronized int getOpenLoaderCount() {
        return openLoaders.size();
    }

    @Override
    public synchronized void close() {
        release();
    }

    private List<Path> resolve(String searchPath) {
        if (searchPath == null || searchPath.isBlank()) {
            return List.of();
        }
        Path path;
        try {
            path = Path.of(searchPath.trim());
        } catch (InvalidPathException e) {
            log.warn("Ignoring invalid handler path {}: {}", searchPath, e.getMessage());
            return List.of();
        }
        if (!Files.exists(path)) {
            log.warn("Handler path does not exist: {}", path);
            return List.of();
        }
        if (!Files.isDirectory(path)) {
            if (isCandidate(path)) {
                return List.of(path);
            }
            log.warn("Ignoring handler path {}: not a .java source or .jar archive", path);
            return List.of();
        }
        try (Stream<Path> entries = Files.walk(path)) {
            List<Path> files = entries.filter(Files::isRegularFile)
                    .filter(HandlerLoader::isCandidate)
                    .sorted()
                    .collect(Collectors.toList());
            if (files.isEmpty()) {
                log.warn("No handler files found in {}", path);
            }
            return files;
        } catch (IOException e) {
            log.warn("Cannot list handler directory {}: {}", path, e.getMessage());
            return List.of();
        }
    }

    static boolean isCandidate(Path path) {
        String name = path.getFileName().toString();
        if (MARKER_SOURCES.contains(name)) {
            return false;
        }
        return name.endsWith(".java") || isArchive(path);
    }

    private static boolean isArchive(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".jar");
    }

    private List<Object> loadSource(Path source) {
        Path outputDir = createOutputDir(source);
        compiler.compile(source, outputDir);

        URLClassLoader loader = openLoader(source, outputDir);
        List<String> classNames = topLevelClassNames(source, outputDir);
        List<Object> modules = new ArrayList<>();
        for (String className : classNames) {
            Class<?> type = initialize(source, className, loader);
            if (contributesHandlers(type)) {
                modules.add(instantiate(source, type));
            }
        }
        return modules;
    }

    private List<Object> loadArchive(Path archive) {
        List<String> classNames = readServiceEntries(archive);
        if (classNames.isEmpty()) {
            log.warn("Archive {} has no {} entry; nothing to load", archive, SERVICE_ENTRY);
            return List.of();
        }
        URLClassLoader loader = openLoader(archive, archive);
        List<Object> modules = new ArrayList<>();
        for (String className : classNames) {
            Class<?> type = initialize(archive, className, loader);
            modules.add(instantiate(archive, type));
        }
        return modules;
    }

    private List<String> readServiceEntries(Path archive) {
        try (JarFile jar = new JarFile(archive.toFile())) {
            JarEntry entry = jar.getJarEntry(SERVICE_ENTRY);
            if (entry == null) {
                return List.of();
            }
            try (InputStream in = jar.getInputStream(entry);
                    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                return reader.lines()
                        .map(line -> {
                            int comment = line.indexOf('#');
                            return (comment >= 0 ? line.substring(0, comment) : line).trim();
                        })
                        .filter(line -> !line.isEmpty())
                        .distinct()
                        .collect(Collectors.toList());
            }
        } catch (IOException e) {
            throw new HandlerLoadException(archive, "Cannot read archive: " + e.getMessage(), e);
        }
    }

    private static List<String> topLevelClassNames(Path source, Path outputDir) {
        try (Stream<Path> files = Files.walk(outputDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".class"))
                    .filter(p -> !p.getFileName().toString().contains("$"))
                    .map(p -> toClassName(outputDir.relativize(p)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new HandlerLoadException(source, "Cannot read compiled classes: " + e.getMessage(), e);
        }
    }

    private static String toClassName(Path relativeClassFile) {
        String path = relativeClassFile.toString().replace(relativeClassFile.getFileSystem().getSeparator(), ".");
        return path.substring(0, path.length() - ".class".length());
    }

    static boolean contributesHandlers(Class<?> type) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            return false;
        }
        if (HandlerModule.class.isAssignableFrom(type)) {
            return true;
        }
        return Arrays.stream(type.getMethods()).anyMatch(m -> m.isAnnotationPresent(OnEvent.class));
    }

    private static Class<?> initialize(Path file, String className, ClassLoader loader) {
        try {
            return Class.forName(className, true, loader);
        } catch (ClassNotFoundException e) {
            throw new HandlerLoadException(file, "Class " + className + " not found", e);
        } catch (ExceptionInInitializerError e) {
            throw new HandlerLoadException(
                    file, "Initialization of " + className + " failed: " + e.getCause(), e.getCause());
        }
    }

    private static Object instantiate(Path file, Class<?> type) {
        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new HandlerLoadException(
                    file, "Handler class " + type.getName() + " needs a no-argument constructor", e);
        } catch (InvocationTargetException e) {
            throw new HandlerLoadException(
                    file, "Constructor of " + type.getName() + " failed: " + e.getCause(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new HandlerLoadException(
                    file, "Cannot instantiate " + type.getName() + ": " + e.getMessage(), e);
        }
    }

    /** Finds {@link OnEvent} methods on a handler instance, sorted by name. */
    public static List<Method> annotatedMethods(Class<?> type) {
        return Arrays.stream(type.getMethods())
                .filter(m -> m.isAnnotationPresent(OnEvent.class))
                .sorted(Comparator.comparing(Method::getName))
                .collect(Collectors.toList());
    }

    private URLClassLoader openLoader(Path file, Path root) {
        try {
            URLClassLoader loader = new URLClassLoader(
                    "handlers:" + file.getFileName(), new URL[] {root.toUri().toURL()}, parentLoader);
            openLoaders.add(loader);
            return loader;
        } catch (MalformedURLException e) {
            throw new HandlerLoadException(file, "Invalid class location " + root, e);
        }
    }

    private Path createOutputDir(Path source) {
        try {
            Path dir = Files.createTempDirectory("event-daemon-handlers-");
            outputDirs.add(dir);
            return dir;
        } catch (IOException e) {
            throw new HandlerLoadException(source, "Cannot create class output directory", e);
        }
    }

    private void release() {
        for (URLClassLoader loader : openLoaders) {
            try {
                loader.close();
            } catch (IOException e) {
                log.warn("Failed to close handler class loader {}: {}", loader.getName(), e.getMessage());
            }
        }
        openLoaders.clear();
        for (Path dir : outputDirs) {
            deleteRecursively(dir);
        }
        outputDirs.clear();
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> files = Files.walk(dir)) {
            for (Path p : files.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("Failed to delete handler output directory {}: {}", dir, e.getMessage());
        }
    }
}
