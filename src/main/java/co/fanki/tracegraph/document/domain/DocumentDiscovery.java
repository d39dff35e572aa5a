package co.fanki.tracegraph.document.domain;

import co.fanki.tracegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds every document under a project root.
 *
 * <p>Walks the root recursively for {@code .tracegraph.yml} files in
 * sorted path order. A file that cannot be understood is logged and
 * recorded on the resulting tree; the walk continues with the others.
 * Two documents declaring the same prefix stop discovery.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DocumentDiscovery {

    private static final Logger LOG =
            LoggerFactory.getLogger(DocumentDiscovery.class);

    /**
     * Discovers the documents under a root directory.
     *
     * @param root the project root
     * @return the tree of discovered documents
     * @throws NoSuchFileException if the root does not exist
     * @throws IOException if the walk fails
     * @throws DiscoveryException on a duplicate prefix
     */
    public DocumentTree discover(final Path root) throws IOException {
        Preconditions.requireNonNull(root, "Root is required");
        final Path absoluteRoot = root.toAbsolutePath().normalize();

        if (!Files.isDirectory(absoluteRoot)) {
            throw new NoSuchFileException(absoluteRoot.toString(), null,
                    "Project root is not a directory");
        }

        final DocumentTree tree = new DocumentTree(absoluteRoot);

        for (final Path configFile : configFiles(absoluteRoot)) {
            try {
                final Document document = DocumentConfigReader.read(configFile);
                tree.add(document);
                LOG.debug("Found document {} at {}", document.prefix(),
                        document.path());
            } catch (final ConfigException e) {
                LOG.warn("Skipping document config {}: {}", configFile,
                        e.getMessage());
                tree.addProblem(configFile, e.getMessage());
            }
        }

        LOG.info("Discovered {} documents under {}", tree.size(), absoluteRoot);
        return tree;
    }

    private List<Path> configFiles(final Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> Document.CONFIG_FILE.equals(
                            p.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

}
