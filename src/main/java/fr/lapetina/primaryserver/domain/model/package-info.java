/**
 * Domain model classes shared by the primary server and its workers.
 *
 * <p>This package contains the value objects exchanged on the work, status and
 * control channels.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.primaryserver.domain.model.RunConfig} - Parameters of one generation cycle</li>
 *   <li>{@link fr.lapetina.primaryserver.domain.model.PrimaryEvent} - One generated event and its header</li>
 *   <li>{@link fr.lapetina.primaryserver.domain.model.PrimaryChunk} - Slice of an event handed to one worker request</li>
 *   <li>{@link fr.lapetina.primaryserver.domain.model.SubEventInfo} - Positional metadata of a chunk</li>
 *   <li>{@link fr.lapetina.primaryserver.domain.model.LifecycleState} - Server lifecycle states reported on the status channel</li>
 *   <li>{@link fr.lapetina.primaryserver.domain.model.ReconfigRequest} - Control input of a server running as a service</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Everything here is immutable. {@code PrimaryEvent} is built on the generation thread
 * and published to the serving thread through the generation future.
 */
package fr.lapetina.primaryserver.domain.model;
