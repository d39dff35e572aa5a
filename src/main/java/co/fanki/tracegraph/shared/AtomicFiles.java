package co.fanki.tracegraph.shared;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;

/**
 * Whole-file writes that readers observe as either the old or the new
 * content, never a partial file.
 *
 * <p>Content goes to a sibling temporary file, is forced to disk, and then
 * replaces the target with an atomic move. The temporary file is created
 * with the process umask and takes over the permissions of the file it
 * replaces.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AtomicFiles {

    /** Prefix of temporary files; never matches an item or config name. */
    public static final String TEMP_PREFIX = ".tmp_";

    private AtomicFiles() {
    }

    /**
     * Replaces the target file with the given content.
     *
     * @param target the file to create or replace
     * @param content the complete new content
     * @throws IOException if writing or replacing fails; the target is
     *         left untouched and the temporary file is removed
     */
    public static void write(final Path target, final byte[] content)
            throws IOException {
        Preconditions.requireNonNull(target, "Target path is required");
        Preconditions.requireNonNull(content, "Content is required");

        final Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);

        final Path temp = directory.resolve(TEMP_PREFIX
                + target.getFileName() + ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                final ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            copyPermissions(target, temp);
            move(temp, target);
        } catch (final IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (final IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private static void copyPermissions(final Path from, final Path to)
            throws IOException {
        if (!Files.isRegularFile(from) || Files.getFileAttributeView(from,
                PosixFileAttributeView.class) == null) {
            return;
        }
        Files.setPosixFilePermissions(to, Files.getPosixFilePermissions(from));
    }

    private static void move(final Path source, final Path target)
            throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

}
