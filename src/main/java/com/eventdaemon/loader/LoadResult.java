package com.eventdaemon.loader;

import java.nio.file.Path;
import java.util.List;
import lombok.Value;

/**
 * Outcome of loading one handler file. A successful result carries the handler instances the
 * file produced (possibly none); a failed one carries the error and no instances.
 */
@Value
public class LoadResult {

    Path path;
    List<Object> modules;
    Throwable error;

    public static LoadResult success(Path path, List<Object> modules) {
        return new LoadResult(path, List.copyOf(modules), null);
    }

    public static LoadResult failure(Path path, Throwable error) {
        return new LoadResult(path, List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
