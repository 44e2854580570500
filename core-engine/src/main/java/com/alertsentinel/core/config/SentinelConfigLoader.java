package com.alertsentinel.core.config;

import com.alertsentinel.core.error.ValidationException;
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
 * Loads and validates {@link SentinelConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*} method resolves the parsed configuration before
 * returning it, so a malformed rule, an unknown action name or a duplicate
 * key fails at start-up rather than at evaluation time.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "SENTINEL_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "sentinel.yml";

    private SentinelConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws ValidationException if validation fails
     */
    public static ResolvedConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    /**
     * Load from {@code path} when it names an existing file, otherwise from
     * {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @param path optional file system path
     * @return parsed and validated configuration
     */
    public static ResolvedConfig load(String path) {
        if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
            LOG.info("Loading sentinel configuration from path: {}", path);
            return fromFile(path);
        }
        LOG.info("Loading sentinel configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     * @throws ValidationException      if validation fails
     */
    public static ResolvedConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndResolve(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws ValidationException      if validation fails
     */
    public static ResolvedConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SentinelConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndResolve(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse without resolving. Exposed for callers that want to inspect the
     * raw definitions.
     *
     * @param is YAML stream
     * @return raw configuration, never {@code null}
     * @throws ValidationException if the YAML is malformed
     */
    public static SentinelConfig parse(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(SentinelConfig.class, options));
        SentinelConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ValidationException("Malformed sentinel configuration: " + e.getMessage(), e);
        }
        return config != null ? config : new SentinelConfig();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ResolvedConfig parseAndResolve(InputStream is) {
        ResolvedConfig resolved = parse(is).resolve();
        if (resolved.getAlertRules().isEmpty() && resolved.getResponseRules().isEmpty()) {
            LOG.warn("No alert or response rules defined in configuration");
        }
        LOG.info("Loaded {} alert rule(s), {} response rule(s), {} escalation polic(ies)",
                resolved.getAlertRules().size(),
                resolved.getResponseRules().size(),
                resolved.getEscalationPolicies().size());
        return resolved;
    }
}
