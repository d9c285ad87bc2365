package mc.orchestrator.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstanceDirectoriesTest {

    @TempDir
    Path tmp;

    @Test
    void rejectsNamesThatEscapeTheRoot() {
        InstanceDirectories directories = new InstanceDirectories(tmp);

        assertThatThrownBy(() -> directories.resolve("../etc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> directories.resolve("..")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> directories.resolve(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listsOnlyDirectoriesSorted() throws IOException {
        Files.createDirectories(tmp.resolve("zeta"));
        Files.createDirectories(tmp.resolve("alpha"));
        Files.writeString(tmp.resolve("notes.txt"), "x");

        assertThat(new InstanceDirectories(tmp).listNames()).containsExactly("alpha", "zeta");
    }

    @Test
    void renameRefusesExistingTarget() throws IOException {
        Files.createDirectories(tmp.resolve("a"));
        Files.createDirectories(tmp.resolve("b"));
        InstanceDirectories directories = new InstanceDirectories(tmp);

        assertThatThrownBy(() -> directories.rename("a", "b")).isInstanceOf(IOException.class);
        assertThat(tmp.resolve("a")).isDirectory();
    }

    @Test
    void renameMovesDirectory() throws IOException {
        Files.createDirectories(tmp.resolve("a"));
        Files.writeString(tmp.resolve("a/server.properties"), "motd=hi\n");

        new InstanceDirectories(tmp).rename("a", "b");

        assertThat(tmp.resolve("b/server.properties")).hasContent("motd=hi");
        assertThat(tmp.resolve("a")).doesNotExist();
    }

    @Test
    void deleteRemovesTreeAndReportsMissing() throws IOException {
        Files.createDirectories(tmp.resolve("gone/world/region"));
        Files.writeString(tmp.resolve("gone/world/region/r.0.0.mca"), "data");
        InstanceDirectories directories = new InstanceDirectories(tmp);

        assertThat(directories.delete("gone")).isTrue();
        assertThat(tmp.resolve("gone")).doesNotExist();
        assertThat(directories.delete("gone")).isFalse();
    }

    @Test
    void deleteOfSymlinkKeepsSharedTarget() throws IOException {
        Path root = Files.createDirectories(tmp.resolve("servers"));
        Path shared = Files.createDirectories(tmp.resolve("shared-world"));
        Files.writeString(shared.resolve("level.dat"), "x");
        Files.createSymbolicLink(root.resolve("linked"), shared);

        assertThat(new InstanceDirectories(root).delete("linked")).isTrue();

        assertThat(root.resolve("linked")).doesNotExist();
        assertThat(shared.resolve("level.dat")).exists();
    }

    @Test
    void fallsBackWhenPreferredRootCannotBeCreated() throws IOException {
        Path blocker = Files.writeString(tmp.resolve("blocker"), "file");
        Path fallback = tmp.resolve("fallback");

        InstanceDirectories directories = InstanceDirectories.createWithFallback(blocker.resolve("servers"), fallback);

        assertThat(directories.getRoot()).isEqualTo(fallback.toAbsolutePath().normalize());
        assertThat(fallback).isDirectory();
    }
}
