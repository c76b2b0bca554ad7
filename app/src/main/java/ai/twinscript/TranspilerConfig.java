package ai.twinscript;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Translator settings. Defaults ship in the {@code twinscript-defaults.json} classpath resource; a user file is
 * merged over them key by key, so it only needs to name what it changes.
 */
public record TranspilerConfig(
        String sourceExtension,
        String outputExtension,
        String companionModule,
        Set<String> companionTypes,
        Set<String> plainDataTypes,
        Set<String> dictionaryTypes,
        Set<String> excludedDirectories,
        long debounceMillis,
        int indentWidth,
        String watchImplementation) {
    private static final Logger logger = LogManager.getLogger(TranspilerConfig.class);

    public static final String DEFAULTS_RESOURCE = "/twinscript-defaults.json";

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public TranspilerConfig {
        if (!sourceExtension.startsWith(".") || !outputExtension.startsWith(".")) {
            throw new IllegalArgumentException("Extensions must start with '.': " + sourceExtension + ", "
                    + outputExtension);
        }
        if (debounceMillis < 0 || indentWidth < 0) {
            throw new IllegalArgumentException("debounceMillis and indentWidth must be non-negative");
        }
        companionTypes = Set.copyOf(companionTypes);
        plainDataTypes = Set.copyOf(plainDataTypes);
        dictionaryTypes = Set.copyOf(dictionaryTypes);
        excludedDirectories = Set.copyOf(excludedDirectories);
        watchImplementation = watchImplementation.toLowerCase(Locale.ROOT);
    }

    public static TranspilerConfig defaults() {
        try {
            return MAPPER.treeToValue(defaultsTree(), TranspilerConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + DEFAULTS_RESOURCE, e);
        }
    }

    /** Loads the defaults, overlaid with {@code userFile} when one is given. */
    public static TranspilerConfig load(@Nullable Path userFile) throws IOException {
        if (userFile == null) {
            return defaults();
        }
        var merged = defaultsTree();
        try (var in = Files.newInputStream(userFile)) {
            var user = MAPPER.readTree(in);
            if (!(user instanceof ObjectNode userObject)) {
                throw new IOException("Config file " + userFile + " must contain a JSON object");
            }
            merged.setAll(userObject);
        }
        var config = MAPPER.treeToValue(merged, TranspilerConfig.class);
        logger.debug("Loaded config from {}: {}", userFile, config);
        return config;
    }

    private static ObjectNode defaultsTree() throws IOException {
        try (var in = TranspilerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return (ObjectNode) MAPPER.readTree(in);
        }
    }

    public boolean isSourceFile(Path path) {
        return path.getFileName() != null && path.getFileName().toString().endsWith(sourceExtension);
    }
}
