package fr.lapetina.primaryserver.domain.generator;

import fr.lapetina.primaryserver.domain.model.EventHeader;
import fr.lapetina.primaryserver.domain.model.Particle;
import fr.lapetina.primaryserver.domain.model.PrimaryEvent;
import fr.lapetina.primaryserver.domain.model.RunConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds generators and produces events from them.
 *
 * Cacheable generators live for the whole process, keyed by
 * {@link GeneratorKey}. External kinematics generators are rebuilt on every
 * {@link #initialize(RunConfig)}; the previous one is closed at that point.
 *
 * Thread safety: {@link #initialize} and {@link #produceEvent} run on the
 * generation thread, {@link #reseed} on the serving thread while no
 * generation is in flight.
 */
public final class GeneratorCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GeneratorCoordinator.class);

    static final int MAX_TRIGGER_ATTEMPTS = 1000;

    private final Map<GeneratorKey, Generator> cache = new ConcurrentHashMap<>();
    private final Random random = new Random();
    private volatile Generator uncached;
    private volatile long currentSeed;

    /**
     * Re-seeds the run's random source.
     *
     * @param requested the configured seed; negative asks for a fresh random one
     * @return the seed actually in use
     */
    public long reseed(long requested) {
        long resolved = requested >= 0 ? requested : ThreadLocalRandom.current().nextLong(1, Integer.MAX_VALUE);
        synchronized (random) {
            random.setSeed(resolved);
        }
        currentSeed = resolved;
        log.info("Random source seeded: requested={}, seed={}", requested, resolved);
        return resolved;
    }

    public long getCurrentSeed() {
        return currentSeed;
    }

    /**
     * Checks the parts of a configuration that only fail once generation runs.
     *
     * @throws IllegalArgumentException if the generator is unknown or the trigger is not understood
     */
    public void validate(RunConfig config) {
        if (!GeneratorFactory.isRegistered(config.generator())) {
            throw new IllegalArgumentException("Unknown generator: " + config.generator());
        }
        try {
            Trigger.parse(config.trigger());
        } catch (GenerationException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    /**
     * Returns a ready generator for the configuration, reusing a cached one when allowed.
     *
     * @throws GenerationException if the name is unknown or setup fails
     */
    public Generator initialize(RunConfig config) {
        GeneratorKey key = GeneratorKey.of(config);
        boolean cacheable = GeneratorFactory.isCacheable(config.generator());

        if (cacheable) {
            Generator cached = cache.get(key);
            if (cached != null) {
                log.debug("Reusing cached generator: key={}", key);
                return cached;
            }
        }

        Generator generator = GeneratorFactory.create(config)
                .orElseThrow(() -> new GenerationException("Unknown generator: " + config.generator()));
        if (config.embedIntoFile() != null) {
            generator.embedInto(config.embedIntoFile());
        }
        long start = System.nanoTime();
        generator.init();
        log.info("Generator initialized: name={}, cacheable={}, initMs={}",
                generator.getName(), cacheable, (System.nanoTime() - start) / 1_000_000);

        if (cacheable) {
            cache.put(key, generator);
        } else {
            Generator previous = uncached;
            uncached = generator;
            if (previous != null) {
                previous.close();
            }
        }
        return generator;
    }

    /**
     * Generates one event, regenerating until the configured trigger accepts it.
     *
     * @throws GenerationException if the generator fails or the trigger rejects every attempt
     */
    public PrimaryEvent produceEvent(Generator generator, RunConfig config) {
        Trigger trigger = Trigger.parse(config.trigger());
        for (int attempt = 1; attempt <= MAX_TRIGGER_ATTEMPTS; attempt++) {
            List<Particle> particles;
            synchronized (random) {
                particles = generator.generateParticles(random);
            }
            if (trigger.accept(particles)) {
                EventHeader header = new EventHeader(
                        generator.getName(),
                        particles.size(),
                        currentSeed,
                        config.embedIntoFile(),
                        Instant.now(),
                        generator.headerInfo()
                );
                if (attempt > 1) {
                    log.debug("Trigger accepted event after {} attempts", attempt);
                }
                return new PrimaryEvent(particles, header);
            }
        }
        throw new GenerationException("Trigger '" + config.trigger() + "' rejected "
                + MAX_TRIGGER_ATTEMPTS + " consecutive events");
    }

    int cacheSize() {
        return cache.size();
    }

    @Override
    public void close() {
        cache.values().forEach(Generator::close);
        cache.clear();
        Generator current = uncached;
        uncached = null;
        if (current != null) {
            current.close();
        }
    }
}
