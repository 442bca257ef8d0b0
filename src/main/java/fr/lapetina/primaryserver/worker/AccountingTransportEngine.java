package fr.lapetina.primaryserver.worker;

import fr.lapetina.primaryserver.domain.model.Particle;
import fr.lapetina.primaryserver.domain.model.SubEventInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reference engine: transports nothing, only accounts for what it receives.
 */
public final class AccountingTransportEngine implements TransportEngine {

    private static final Logger log = LoggerFactory.getLogger(AccountingTransportEngine.class);

    public static final String NAME = "accounting";

    private List<Particle> primaries = List.of();
    private SubEventInfo info;
    private long seed;

    private long chunksProcessed;
    private long particlesProcessed;
    private double totalEnergy;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void setPrimaries(List<Particle> primaries, SubEventInfo info) {
        this.primaries = primaries;
        this.info = info;
    }

    @Override
    public void seed(long seed) {
        this.seed = seed;
    }

    @Override
    public void processEvent() {
        if (info == null) {
            throw new IllegalStateException("No primaries set");
        }
        double energy = 0;
        for (Particle particle : primaries) {
            energy += particle.energy();
        }
        chunksProcessed++;
        particlesProcessed += primaries.size();
        totalEnergy += energy;
        log.info("Chunk processed: eventId={}, part={}/{}, particles={}, energy={}, seed={}",
                info.eventId(), info.part(), info.nparts(), primaries.size(), energy, seed);
        primaries = List.of();
        info = null;
    }

    public long getChunksProcessed() {
        return chunksProcessed;
    }

    public long getParticlesProcessed() {
        return particlesProcessed;
    }

    public double getTotalEnergy() {
        return totalEnergy;
    }

    public long getLastSeed() {
        return seed;
    }
}
