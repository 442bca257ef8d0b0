package fr.lapetina.primaryserver.worker;

import fr.lapetina.primaryserver.domain.model.Particle;
import fr.lapetina.primaryserver.domain.model.SubEventInfo;

import java.util.List;

/**
 * Consumer of primary chunks on a worker.
 *
 * The kernel calls {@link #setPrimaries}, then {@link #seed}, then
 * {@link #processEvent()} exactly once per chunk.
 */
public interface TransportEngine {

    String getName();

    void setPrimaries(List<Particle> primaries, SubEventInfo info);

    void seed(long seed);

    void processEvent();
}
