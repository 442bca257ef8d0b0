package fr.lapetina.primaryserver.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Unit of work handed to a single worker request: a slice of one event's
 * primaries plus its positional metadata.
 */
public record PrimaryChunk(SubEventInfo info, List<Particle> particles) {

    public PrimaryChunk {
        Objects.requireNonNull(info, "info");
        particles = particles != null ? List.copyOf(particles) : List.of();
    }

    /**
     * Creates the chunk telling workers that no further work will ever be produced.
     */
    public static PrimaryChunk exhausted(SubEventInfo info) {
        SubEventInfo sentinel = new SubEventInfo(
                SubEventInfo.NO_MORE_EVENTS,
                info.maxEvents(),
                info.part(),
                info.nparts(),
                info.seed(),
                0,
                info.header()
        );
        return new PrimaryChunk(sentinel, List.of());
    }

    /**
     * Empty particles and event ordinal -1. An empty slice of a real event is not a signal.
     */
    @JsonIgnore
    public boolean isExhaustionSignal() {
        return particles.isEmpty() && info.eventId() == SubEventInfo.NO_MORE_EVENTS;
    }

    @Override
    public String toString() {
        return "PrimaryChunk{" +
                "event=" + info.eventId() + "/" + info.maxEvents() +
                ", part=" + info.part() + "/" + info.nparts() +
                ", particles=" + particles.size() +
                '}';
    }
}
