package fr.lapetina.ringbalancer.infrastructure.config;

import fr.lapetina.ringbalancer.domain.hash.HashAlgorithm;
import fr.lapetina.ringbalancer.domain.model.ProbeType;
import fr.lapetina.ringbalancer.domain.ring.ConsistentHashRing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration loader with explicit reload support.
 *
 * Supports:
 * - Loading from file system, falling back to the classpath
 * - Validation of the loaded configuration
 * - Listener notification on changes
 *
 * An invalid configuration is never published: {@link #getCurrentConfig()} keeps
 * returning the last valid one.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<LoadBalancerConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(LoadBalancerConfig.class, loaderOptions));
    }

    /**
     * Loads and validates configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public LoadBalancerConfig load() {
        return publish(loadFromPath());
    }

    /**
     * Loads and validates configuration from an input stream.
     *
     * @throws ConfigurationException if parsing or validation fails
     */
    public LoadBalancerConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    /**
     * Re-reads the configuration source and notifies listeners.
     *
     * @throws ConfigurationException if the new configuration is invalid; the current one is kept
     */
    public LoadBalancerConfig reload() {
        log.info("Reloading configuration: path={}", configPath);
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Returns the current configuration.
     */
    public LoadBalancerConfig getCurrentConfig() {
        return currentConfig.get();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private LoadBalancerConfig publish(LoadBalancerConfig config) {
        validate(config);
        LoadBalancerConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private LoadBalancerConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private LoadBalancerConfig parse(InputStream inputStream, String source) {
        try {
            LoadBalancerConfig config = yaml.load(inputStream);
            return config != null ? config : new LoadBalancerConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Validates a configuration.
     *
     * @throws ConfigurationException on the first violation found
     */
    public static void validate(LoadBalancerConfig config) {
        LoadBalancerConfig.RingConfig ring = config.getRing();
        if (ring == null || ring.getVirtualNodes() < 1) {
            throw new ConfigurationException("ring.virtualNodes must be at least 1");
        }
        try {
            HashAlgorithm.fromName(ring.getHashFunction());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("ring.hashFunction: " + e.getMessage());
        }

        LoadBalancerConfig.HealthCheckConfig health = config.getHealthCheck();
        if (health == null) {
            throw new ConfigurationException("healthCheck section must not be empty");
        }
        if (health.getRetries() < 1) {
            throw new ConfigurationException("healthCheck.retries must be at least 1");
        }
        if (health.getIntervalMs() <= 0 || health.getTimeoutMs() <= 0) {
            throw new ConfigurationException("healthCheck.intervalMs and healthCheck.timeoutMs must be positive");
        }
        probeType(health.getType(), "healthCheck.type");

        LoadBalancerConfig.ServerConfig server = config.getServer();
        if (server == null || server.getPort() < 0 || server.getPort() > 65535) {
            throw new ConfigurationException("server.port must be between 0 and 65535");
        }
        if (server.getThreads() < 1) {
            throw new ConfigurationException("server.threads must be at least 1");
        }

        if (config.getServers() == null) {
            config.setServers(new ArrayList<>());
        }
        Set<String> ids = new HashSet<>();
        for (LoadBalancerConfig.BackendConfig backend : config.getServers()) {
            if (backend.getHost() == null || backend.getHost().isBlank()) {
                throw new ConfigurationException("servers[].host is required");
            }
            String id = backend.resolveId();
            if (!isValidPort(backend.getPort())) {
                throw new ConfigurationException("Invalid port for server " + id + ": " + backend.getPort());
            }
            if (backend.getWeight() < 1) {
                throw new ConfigurationException("Invalid weight for server " + id + ": " + backend.getWeight());
            }
            if ((long) backend.getWeight() * ring.getVirtualNodes() > ConsistentHashRing.MAX_VIRTUAL_NODES_PER_SERVER) {
                throw new ConfigurationException("Weight of server " + id + " exceeds "
                        + ConsistentHashRing.MAX_VIRTUAL_NODES_PER_SERVER + " virtual nodes: " + backend.getWeight());
            }
            if (backend.getHealthCheckType() != null) {
                probeType(backend.getHealthCheckType(), "healthCheckType of server " + id);
            }
            if (!ids.add(id)) {
                throw new ConfigurationException("Duplicate server id: " + id);
            }
        }
    }

    private static ProbeType probeType(String name, String field) {
        try {
            return ProbeType.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(field + ": " + e.getMessage());
        }
    }

    private static boolean isValidPort(int port) {
        return port >= 1 && port <= 65535;
    }

    /**
     * Adds a listener for configuration changes.
     */
    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a configuration change listener.
     */
    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(LoadBalancerConfig oldConfig, LoadBalancerConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
