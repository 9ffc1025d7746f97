package com.cape.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Starts sandboxed processes in a process group of their own, so background
 * children left behind after the leader exits can still be found and killed.
 *
 * <p>Needs {@code setsid} and {@code /proc}, so this only takes effect on
 * Linux. Elsewhere {@link #isolate} returns the command unchanged and only
 * descendants seen while the leader was alive can be reached.
 */
final class ProcessGroups {

    private static final Logger log = LoggerFactory.getLogger(ProcessGroups.class);

    private static final Path PROC = Path.of("/proc");
    private static final String SETSID = findSetsid();

    private ProcessGroups() {}

    static boolean available() {
        return SETSID != null;
    }

    /**
     * Prefixes {@code command} with {@code setsid}. A child started by the JVM
     * is never a group leader, so setsid execs in place and the group id
     * equals the started process's pid.
     */
    static List<String> isolate(List<String> command) {
        if (SETSID == null) {
            return command;
        }
        var wrapped = new ArrayList<String>(command.size() + 1);
        wrapped.add(SETSID);
        wrapped.addAll(command);
        return wrapped;
    }

    static boolean isIsolated(ProcessBuilder builder) {
        return SETSID != null && !builder.command().isEmpty() && SETSID.equals(builder.command().get(0));
    }

    /**
     * Live processes in the group {@code pgid}. Never returns members of the
     * engine's own group.
     */
    static List<ProcessHandle> members(long pgid) {
        if (SETSID == null || pgid <= 0 || pgid == groupOf(ProcessHandle.current().pid())) {
            return List.of();
        }
        return ProcessHandle.allProcesses()
                .filter(h -> groupOf(h.pid()) == pgid)
                .toList();
    }

    /**
     * Reads the process group from {@code /proc/<pid>/stat}; -1 when the
     * process is gone or unreadable.
     */
    static long groupOf(long pid) {
        try {
            String stat = Files.readString(PROC.resolve(Long.toString(pid)).resolve("stat"), StandardCharsets.UTF_8);
            // The command name is parenthesized and may contain spaces
            String[] fields = stat.substring(stat.lastIndexOf(')') + 2).split(" ");
            return Long.parseLong(fields[2]);
        } catch (IOException | RuntimeException e) {
            return -1;
        }
    }

    private static String findSetsid() {
        if (!Files.isDirectory(PROC.resolve("self"))) {
            return null;
        }
        for (String candidate : List.of("/usr/bin/setsid", "/bin/setsid")) {
            if (Files.isExecutable(Path.of(candidate))) {
                return candidate;
            }
        }
        log.info("setsid not found; background processes started by sandboxed code can outlive their run");
        return null;
    }
}
