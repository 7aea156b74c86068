/**
 * Configuration loading and reload support.
 *
 * <p>This package handles YAML configuration parsing, validation and runtime
 * reconfiguration of the server pool without requiring application restart.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ringbalancer.infrastructure.config.LoadBalancerConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.ringbalancer.infrastructure.config.ConfigLoader} - YAML loading and validation</li>
 *   <li>{@link fr.lapetina.ringbalancer.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (host, port, backlog, threads)</li>
 *   <li>{@code ring} - Virtual nodes per unit of weight and hash function</li>
 *   <li>{@code healthCheck} - Probe type, interval, timeout and retries</li>
 *   <li>{@code proxy} - Request forwarding timeouts</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 *   <li>{@code servers} - Backend server pool</li>
 * </ul>
 *
 * @see fr.lapetina.ringbalancer.infrastructure.config.LoadBalancerConfig
 * @see fr.lapetina.ringbalancer.infrastructure.config.ConfigLoader
 */
package fr.lapetina.ringbalancer.infrastructure.config;
