package mc.orchestrator.runtime.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes to another process's standard input through {@code /proc/<pid>/fd/0}.
 */
final class ProcStdin {
    private static final Path PROC = Path.of("/proc");

    private ProcStdin() {
    }

    static boolean isWritable(long pid) {
        Path stdin = stdinOf(pid);
        if (!Files.isWritable(stdin)) {
            return false;
        }
        try {
            return !"/dev/null".equals(Files.readSymbolicLink(stdin).toString());
        } catch (IOException | UnsupportedOperationException e) {
            return false;
        }
    }

    static void write(long pid, String command) throws IOException {
        Files.writeString(stdinOf(pid), command + "\n", StandardCharsets.UTF_8, StandardOpenOption.WRITE,
                StandardOpenOption.APPEND);
    }

    private static Path stdinOf(long pid) {
        return PROC.resolve(Long.toString(pid)).resolve("fd").resolve("0");
    }
}
