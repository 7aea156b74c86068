package fr.lapetina.ringbalancer.infrastructure.config;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called once a loaded configuration has passed validation.
     *
     * @param oldConfig The previous configuration (null on initial load)
     * @param newConfig The new configuration
     */
    void onConfigChanged(LoadBalancerConfig oldConfig, LoadBalancerConfig newConfig);
}
