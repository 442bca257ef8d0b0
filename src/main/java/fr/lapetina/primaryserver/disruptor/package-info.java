/**
 * LMAX Disruptor based serving loop of the primary server.
 *
 * <p>Work-channel requests are published by the HTTP threads into a ring buffer
 * consumed by exactly one handler thread. All cursor and state mutations of the
 * {@link fr.lapetina.primaryserver.server.JobServer} happen on that thread, so
 * requests are served in arrival order without locks.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.primaryserver.disruptor.WorkRequestPipeline} - Ring buffer and serving thread</li>
 *   <li>{@link fr.lapetina.primaryserver.disruptor.handlers.ServingHandler} - Serves one request, then applies state transitions</li>
 *   <li>{@link fr.lapetina.primaryserver.disruptor.exception.BackpressureException} - Thrown when the ring buffer is full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.primaryserver.disruptor;
