package co.fanki.tracegraph.document.domain;

import co.fanki.tracegraph.shared.AtomicFiles;
import co.fanki.tracegraph.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the per-document {@code .tracegraph.yml} file.
 *
 * <pre>
 * settings:
 *   prefix: SRS
 *   parents: [SYS]
 *   digits: 3
 *   sep: ""
 * </pre>
 *
 * <p>{@code parents} accepts a list or a single scalar. Every problem with
 * the file content surfaces as a {@link ConfigException}; I/O failures
 * propagate unchanged.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DocumentConfigReader {

    private static final ObjectMapper MAPPER = new ObjectMapper(
            YAMLFactory.builder()
                    .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                    .build());

    private DocumentConfigReader() {
    }

    /**
     * Reads the configuration file of a document.
     *
     * @param configFile the {@code .tracegraph.yml} file
     * @return the document, located in the file's directory
     * @throws IOException if the file cannot be read
     * @throws ConfigException if the content is invalid
     */
    public static Document read(final Path configFile) throws IOException {
        Preconditions.requireNonNull(configFile, "Config file is required");
        final Path directory = configFile.toAbsolutePath().getParent();
        return parse(directory, Files.readAllBytes(configFile),
                configFile.toString());
    }

    /**
     * Parses configuration bytes.
     *
     * @param directory the document directory
     * @param content the raw YAML
     * @param source the name reported in errors
     * @return the document
     * @throws ConfigException if the content is invalid
     */
    public static Document parse(final Path directory, final byte[] content,
            final String source) {

        final JsonNode root;
        try {
            root = MAPPER.readTree(content);
        } catch (final IOException e) {
            throw new ConfigException(source, "Malformed YAML", e);
        }

        if (root == null || !root.isObject()) {
            throw new ConfigException(source, "Missing 'settings' section");
        }
        final JsonNode settings = root.get("settings");
        if (settings == null || !settings.isObject()) {
            throw new ConfigException(source, "Missing 'settings' section");
        }

        final JsonNode prefixNode = settings.get("prefix");
        if (prefixNode == null || !prefixNode.isTextual()
                || prefixNode.asText().isBlank()) {
            throw new ConfigException(source, "Missing 'prefix' setting");
        }

        final List<String> parents = readParents(settings.get("parents"),
                source);

        int digits = Document.DEFAULT_DIGITS;
        final JsonNode digitsNode = settings.get("digits");
        if (digitsNode != null && !digitsNode.isNull()) {
            if (!digitsNode.canConvertToInt() || !digitsNode.isIntegralNumber()) {
                throw new ConfigException(source,
                        "'digits' must be an integer");
            }
            digits = digitsNode.asInt();
        }

        String sep = "";
        final JsonNode sepNode = settings.get("sep");
        if (sepNode != null && !sepNode.isNull()) {
            if (!sepNode.isValueNode() || sepNode.isBoolean()) {
                throw new ConfigException(source, "'sep' must be a string");
            }
            sep = sepNode.asText();
        }

        try {
            return Document.of(prefixNode.asText().trim(), directory, parents,
                    digits, sep);
        } catch (final IllegalArgumentException e) {
            throw new ConfigException(source, e.getMessage(), e);
        }
    }

    /**
     * Writes the configuration file of a document atomically, creating the
     * directory when needed.
     *
     * @param document the document to persist
     * @throws IOException if the file cannot be written
     */
    public static void write(final Document document) throws IOException {
        Preconditions.requireNonNull(document, "Document is required");
        Files.createDirectories(document.path());
        AtomicFiles.write(document.configFile(), toBytes(document));
    }

    /**
     * Renders a document's configuration.
     *
     * @param document the document
     * @return the YAML bytes
     */
    static byte[] toBytes(final Document document) {
        final ObjectNode root = MAPPER.createObjectNode();
        final ObjectNode settings = root.putObject("settings");
        settings.put("prefix", document.prefix());
        if (!document.parents().isEmpty()) {
            final ArrayNode parents = settings.putArray("parents");
            document.parents().forEach(parents::add);
        }
        settings.put("digits", document.digits());
        settings.put("sep", document.sep());
        try {
            return MAPPER.writeValueAsBytes(root);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException(
                    "Cannot render config of " + document.prefix(), e);
        }
    }

    private static List<String> readParents(final JsonNode node,
            final String source) {
        final List<String> parents = new ArrayList<>();
        if (node == null || node.isNull()) {
            return parents;
        }
        if (node.isArray()) {
            for (final JsonNode entry : node) {
                if (!entry.isTextual() || entry.asText().isBlank()) {
                    throw new ConfigException(source,
                            "'parents' entries must be document prefixes");
                }
                parents.add(entry.asText().trim());
            }
            return parents;
        }
        if (node.isTextual()) {
            if (!node.asText().isBlank()) {
                parents.add(node.asText().trim());
            }
            return parents;
        }
        throw new ConfigException(source,
                "'parents' must be a list or a single prefix");
    }

}
