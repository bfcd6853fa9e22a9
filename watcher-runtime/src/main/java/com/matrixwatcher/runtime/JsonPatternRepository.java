package com.matrixwatcher.runtime;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.matrixwatcher.core.pattern.PatternRepository;
import com.matrixwatcher.core.pattern.TrackerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link PatternRepository} that keeps the tracker state as three JSON files
 * in one directory.
 *
 * <h3>Files</h3>
 * <ul>
 * <li>{@value #PATTERNS_FILE} - condition key to event type to pattern
 * statistics</li>
 * <li>{@value #CONDITIONS_FILE} - recent conditions with their matched event
 * types</li>
 * <li>{@value #PRICES_FILE} - crypto price samples per asset inside the
 * lookback window</li>
 * </ul>
 *
 * <p>
 * Each file is written to a temporary sibling and moved into place, so a
 * crash mid-write leaves the previous version intact. Missing files load as
 * an empty state; unreadable JSON is reported as an {@link IOException}.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonPatternRepository implements PatternRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JsonPatternRepository.class);

    public static final String PATTERNS_FILE = "patterns.json";
    public static final String CONDITIONS_FILE = "recent_conditions.json";
    public static final String PRICES_FILE = "price_history.json";

    private static final TypeReference<Map<String, Map<String, Map<String, Object>>>> PATTERNS_TYPE =
            new TypeReference<>() {
            };
    private static final TypeReference<List<Map<String, Object>>> CONDITIONS_TYPE =
            new TypeReference<>() {
            };
    private static final TypeReference<Map<String, List<Map<String, Object>>>> PRICES_TYPE =
            new TypeReference<>() {
            };

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonPatternRepository(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Storage directory must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public TrackerState load() throws IOException {
        Path patternsPath = directory.resolve(PATTERNS_FILE);
        Path conditionsPath = directory.resolve(CONDITIONS_FILE);
        Path pricesPath = directory.resolve(PRICES_FILE);

        Map<String, Map<String, Map<String, Object>>> patterns = Collections.emptyMap();
        List<Map<String, Object>> conditions = Collections.emptyList();
        Map<String, List<Map<String, Object>>> prices = Collections.emptyMap();

        if (Files.exists(patternsPath)) {
            Map<String, Map<String, Map<String, Object>>> read = mapper.readValue(patternsPath.toFile(), PATTERNS_TYPE);
            if (read != null) {
                patterns = read;
            }
        } else {
            LOG.info("No stored patterns at {}", patternsPath);
        }
        if (Files.exists(conditionsPath)) {
            List<Map<String, Object>> read = mapper.readValue(conditionsPath.toFile(), CONDITIONS_TYPE);
            if (read != null) {
                conditions = read;
            }
        }
        if (Files.exists(pricesPath)) {
            Map<String, List<Map<String, Object>>> read = mapper.readValue(pricesPath.toFile(), PRICES_TYPE);
            if (read != null) {
                prices = read;
            }
        }

        LOG.debug("Loaded {} pattern group(s), {} condition(s) and {} priced asset(s) from {}",
                patterns.size(), conditions.size(), prices.size(), directory);
        return new TrackerState(patterns, conditions, prices);
    }

    @Override
    public void save(TrackerState state) throws IOException {
        Objects.requireNonNull(state, "TrackerState must not be null");
        Files.createDirectories(directory);
        writeAtomically(directory.resolve(PATTERNS_FILE), mapper.writeValueAsBytes(state.getPatterns()));
        writeAtomically(directory.resolve(CONDITIONS_FILE), mapper.writeValueAsBytes(state.getRecentConditions()));
        writeAtomically(directory.resolve(PRICES_FILE), mapper.writeValueAsBytes(state.getPriceHistory()));
        LOG.debug("Saved {} pattern group(s) and {} condition(s) to {}",
                state.getPatterns().size(), state.getRecentConditions().size(), directory);
    }

    public Path getDirectory() {
        return directory;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, content);
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}, replacing in place", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
