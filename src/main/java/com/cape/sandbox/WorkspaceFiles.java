package com.cape.sandbox;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Snapshot and change detection for a run directory.
 */
public final class WorkspaceFiles {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceFiles.class);

    /**
     * Modification time and size of a file at snapshot time.
     */
    public record FileStamp(long modifiedMillis, long size) {}

    private WorkspaceFiles() {}

    /**
     * Takes a snapshot of all regular files under {@code dir}, keyed by
     * relative path with {@code /} separators.
     */
    public static Map<String, FileStamp> snapshot(Path dir) {
        var files = new HashMap<String, FileStamp>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.filter(Files::isRegularFile).forEach(p -> {
                try {
                    files.put(relative(dir, p),
                            new FileStamp(Files.getLastModifiedTime(p).toMillis(), Files.size(p)));
                } catch (IOException e) {
                    log.debug("Could not stat {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not snapshot {}: {}", dir, e.getMessage());
        }
        return files;
    }

    /**
     * Collects files created or modified since {@code before}. Reserved files
     * and the request's input files are excluded.
     *
     * @return relative path to content, sorted by path
     */
    public static Map<String, byte[]> collectProduced(Path dir, Map<String, FileStamp> before,
                                                      Set<String> inputFiles) throws IOException {
        var produced = new TreeMap<String, byte[]>();
        Map<String, FileStamp> after = snapshot(dir);
        for (var entry : after.entrySet()) {
            String path = entry.getKey();
            if (ExchangeFiles.isReserved(path) || inputFiles.contains(path)) {
                continue;
            }
            FileStamp previous = before.get(path);
            if (previous == null || !previous.equals(entry.getValue())) {
                produced.put(path, Files.readAllBytes(dir.resolve(path)));
            }
        }
        return produced;
    }

    /**
     * Writes input files into {@code dir}. Names must stay inside the directory.
     */
    public static void writeInputFiles(Path dir, Map<String, byte[]> files) throws IOException {
        for (var entry : files.entrySet()) {
            Path target = resolveInside(dir, entry.getKey());
            Files.createDirectories(target.getParent());
            Files.write(target, entry.getValue());
        }
    }

    static Path resolveInside(Path dir, String name) {
        Path root = dir.toAbsolutePath().normalize();
        Path target = root.resolve(name).normalize();
        if (name.isBlank() || !target.startsWith(root) || target.equals(root)) {
            throw new CapeException(ErrorKind.VALIDATION_ERROR, "Input file escapes the working area: " + name);
        }
        return target;
    }

    /**
     * Deletes a directory tree, logging instead of failing on leftovers.
     *
     * @return false when something could not be deleted
     */
    public static boolean deleteQuietly(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return true;
        }
        var failures = new ArrayList<String>();
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    failures.add(p + " (" + e.getMessage() + ")");
                }
            });
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not clean up {}: {}", dir, e.getMessage());
            return false;
        }
        if (!failures.isEmpty()) {
            log.warn("Left {} undeletable entries under {}, first: {}", failures.size(), dir, failures.get(0));
            return false;
        }
        return true;
    }

    private static String relative(Path dir, Path file) {
        return dir.relativize(file).toString().replace('\\', '/');
    }
}
