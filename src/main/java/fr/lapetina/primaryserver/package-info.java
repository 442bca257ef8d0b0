/**
 * Primary Server - distributes generated primary particles to a pool of stateless workers.
 *
 * <p>One central producer generates events asynchronously, cuts them into chunks and
 * hands the chunks out on a request/reply work channel, one chunk per request, until
 * the event budget is spent. A separate status channel reports the lifecycle state,
 * and a control channel reconfigures an idle server running as a service.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.primaryserver.ServerFactory} - Wires a server from YAML configuration</li>
 *   <li>{@link fr.lapetina.primaryserver.PrimaryServerApplication} - Standalone server process</li>
 *   <li>{@link fr.lapetina.primaryserver.worker.WorkerApplication} - Standalone worker process</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ServerFactory server = ServerFactory.create("config.yaml").start()) {
 *     server.awaitServingFinished();
 * }
 * }</pre>
 *
 * @see fr.lapetina.primaryserver.server.JobServer
 * @see fr.lapetina.primaryserver.disruptor.WorkRequestPipeline
 */
package fr.lapetina.primaryserver;
