package fr.lapetina.primaryserver.domain.generator;

import fr.lapetina.primaryserver.domain.model.Particle;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Source of primary particles.
 *
 * <p>Implementations must be registered with {@link GeneratorFactory}. The
 * coordinator calls {@link #embedInto(String)} (when configured) and
 * {@link #init()} once, then {@link #generateParticles(Random)} once per event,
 * always from the generation thread.
 */
public interface Generator extends AutoCloseable {

    /**
     * Returns the registry name of this generator.
     */
    String getName();

    /**
     * Wires the generator to an existing background event stream.
     *
     * @param source location of the background events
     */
    void embedInto(String source);

    /**
     * One-time, possibly expensive, setup.
     *
     * @throws GenerationException if the generator cannot be set up
     */
    void init();

    /**
     * Generates the primaries of one event.
     *
     * @param random the run's random source
     * @return the primaries, in generation order
     * @throws GenerationException if no event can be produced
     */
    List<Particle> generateParticles(Random random);

    /**
     * Extra key/value pairs recorded in the header of every event.
     */
    default Map<String, String> headerInfo() {
        return Map.of();
    }

    @Override
    default void close() {
        // Nothing to release by default
    }
}
