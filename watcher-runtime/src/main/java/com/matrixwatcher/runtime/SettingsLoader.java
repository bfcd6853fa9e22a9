package com.matrixwatcher.runtime;

import com.matrixwatcher.core.config.WatcherSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link WatcherSettings} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Explicit file system path passed to {@link #load(String)}</li>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link WatcherSettings#validate()} after
 * parsing so that the process <strong>fails fast</strong> on a bad
 * configuration. Duplicate keys, unknown properties and YAML syntax errors
 * are reported as {@link IllegalStateException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "WATCHER_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "watcher.yml";

    private SettingsLoader() {
        // utility class - not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load settings using automatic resolution.
     *
     * @param explicitPath path that wins over everything else; may be
     *                     {@code null} or blank
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the explicit path does not exist
     * @throws IllegalStateException    if validation fails
     */
    public static WatcherSettings load(String explicitPath) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            LOG.info("Loading watcher settings from: {}", explicitPath);
            return fromFile(explicitPath);
        }
        return load();
    }

    /**
     * Load settings from {@value #ENV_CONFIG_PATH} when it names an existing
     * file, otherwise from the classpath. A missing classpath resource yields
     * the defaults.
     *
     * @return parsed and validated settings
     * @throws IllegalStateException if validation fails
     */
    public static WatcherSettings load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading watcher settings from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (SettingsLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.warn("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
            WatcherSettings defaults = new WatcherSettings();
            defaults.validate();
            return defaults;
        }
        LOG.info("Loading watcher settings from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load settings from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated settings
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static WatcherSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + path, e);
        }
    }

    /**
     * Load settings from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated settings
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static WatcherSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static WatcherSettings parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(WatcherSettings.class, options));
        WatcherSettings settings;
        try {
            settings = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed watcher configuration: " + e.getMessage(), e);
        }

        if (settings == null) {
            LOG.warn("Empty watcher configuration, using defaults");
            settings = new WatcherSettings();
        }
        settings.validate();

        if (settings.getEvents().isEmpty()) {
            LOG.info("Loaded watcher settings with the built-in event table");
        } else {
            LOG.info("Loaded watcher settings with {} event definition(s)", settings.getEvents().size());
        }
        return settings;
    }
}
