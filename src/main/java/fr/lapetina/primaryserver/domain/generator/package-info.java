/**
 * Event generation.
 *
 * <p>Generators are registered by name with
 * {@link fr.lapetina.primaryserver.domain.generator.GeneratorFactory} and driven by the
 * {@link fr.lapetina.primaryserver.domain.generator.GeneratorCoordinator}, which caches
 * instances by {@link fr.lapetina.primaryserver.domain.generator.GeneratorKey}.
 *
 * <h2>Available Generators</h2>
 * <table border="1">
 *   <tr><th>Name</th><th>Source</th><th>Cached</th></tr>
 *   <tr><td>{@code boxgen}</td><td>Particle gun, uniform momentum</td><td>yes</td></tr>
 *   <tr><td>{@code extkin}</td><td>Whitespace separated text file</td><td>no</td></tr>
 *   <tr><td>{@code extkinO2}</td><td>JSON lines file</td><td>no</td></tr>
 * </table>
 *
 * <h2>Custom Generators</h2>
 * <p>Extend {@link fr.lapetina.primaryserver.domain.generator.AbstractGenerator} and register
 * the constructor:
 * <pre>{@code
 * GeneratorFactory.register("mygen", MyGenerator::new);
 * }</pre>
 */
package fr.lapetina.primaryserver.domain.generator;
