package fr.lapetina.primaryserver.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * One generated event: the ordered primaries plus the event header.
 *
 * Produced on the generation thread and handed over to the serving thread
 * through the generation future; never modified after that.
 */
public final class PrimaryEvent {

    private static final PrimaryEvent EMPTY = new PrimaryEvent(List.of(), EventHeader.empty());

    private final List<Particle> particles;
    private final EventHeader header;

    public PrimaryEvent(List<Particle> particles, EventHeader header) {
        this.particles = List.copyOf(particles);
        this.header = Objects.requireNonNull(header, "header").withPrimaries(this.particles.size());
    }

    /**
     * Placeholder held by the server before the first event is adopted.
     */
    public static PrimaryEvent empty() {
        return EMPTY;
    }

    public List<Particle> getParticles() {
        return particles;
    }

    public EventHeader getHeader() {
        return header;
    }

    public int size() {
        return particles.size();
    }

    /**
     * Returns the particles in {@code [start, end)}.
     */
    public List<Particle> slice(int start, int end) {
        return particles.subList(start, end);
    }

    @Override
    public String toString() {
        return "PrimaryEvent{" +
                "primaries=" + particles.size() +
                ", generator=" + header.generator() +
                '}';
    }
}
