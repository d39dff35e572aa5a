package co.fanki.tracegraph.shared;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for AtomicFiles.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AtomicFilesTest {

    @TempDir
    Path dir;

    @Test
    void whenWrite_givenNewFile_shouldCreateItWithoutLeftovers()
            throws IOException {
        final Path target = dir.resolve("SRS001.yml");

        AtomicFiles.write(target, "text: hello\n".getBytes(
                StandardCharsets.UTF_8));

        assertEquals("text: hello\n", Files.readString(target));
        assertEquals(List.of("SRS001.yml"), names(dir));
    }

    @Test
    void whenWrite_givenExistingFile_shouldReplaceContent() throws IOException {
        final Path target = dir.resolve("SRS001.yml");
        Files.writeString(target, "old");

        AtomicFiles.write(target, "new".getBytes(StandardCharsets.UTF_8));

        assertEquals("new", Files.readString(target));
        assertEquals(List.of("SRS001.yml"), names(dir));
    }

    @Test
    void whenWrite_givenSharedReadableFile_shouldKeepPermissions()
            throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews()
                .contains("posix"));
        final Path target = dir.resolve("SRS001.yml");
        Files.writeString(target, "old");
        final Set<PosixFilePermission> shared =
                PosixFilePermissions.fromString("rw-rw-r--");
        Files.setPosixFilePermissions(target, shared);

        AtomicFiles.write(target, "new".getBytes(StandardCharsets.UTF_8));

        assertEquals(shared, Files.getPosixFilePermissions(target));
    }

    @Test
    void whenWrite_givenNewFile_shouldBeReadableByGroup() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews()
                .contains("posix"));
        final Path sibling = Files.writeString(dir.resolve("plain.yml"), "x");
        final Path target = dir.resolve("SRS001.yml");

        AtomicFiles.write(target, "new".getBytes(StandardCharsets.UTF_8));

        assertEquals(Files.getPosixFilePermissions(sibling),
                Files.getPosixFilePermissions(target));
    }

    @Test
    void whenWrite_givenMissingDirectory_shouldCreateIt() throws IOException {
        final Path target = dir.resolve("reqs/srs/SRS001.yml");

        AtomicFiles.write(target, new byte[0]);

        assertEquals(0, Files.size(target));
    }

    @Test
    void whenWrite_givenTargetIsDirectory_shouldFailAndCleanUp()
            throws IOException {
        final Path target = Files.createDirectory(dir.resolve("SRS001.yml"));
        Files.writeString(target.resolve("inside"), "x");

        assertThrows(IOException.class, () -> AtomicFiles.write(target,
                "x".getBytes(StandardCharsets.UTF_8)));

        assertEquals(List.of("SRS001.yml"), names(dir));
    }

    private static List<String> names(final Path directory)
            throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(p -> p.getFileName().toString()).sorted()
                    .collect(Collectors.toList());
        }
    }

}
