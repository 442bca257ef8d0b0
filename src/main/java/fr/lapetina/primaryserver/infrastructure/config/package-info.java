/**
 * Configuration loading.
 *
 * <p>YAML is bound to {@link fr.lapetina.primaryserver.infrastructure.config.PrimaryServerConfig}
 * by {@link fr.lapetina.primaryserver.infrastructure.config.ConfigLoader}, then
 * {@link fr.lapetina.primaryserver.infrastructure.config.EnvironmentOverrides} applies the
 * {@code PRIMSERVER_*} environment variables.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - work and status channel ports, reply timeout</li>
 *   <li>{@code run} - parameters of the first generation cycle</li>
 *   <li>{@code service} - service mode, control timeout, driver pipe</li>
 *   <li>{@code disruptor} - ring buffer and wait strategy settings</li>
 *   <li>{@code worker} - worker endpoints, timeouts and back-off</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.primaryserver.infrastructure.config;
