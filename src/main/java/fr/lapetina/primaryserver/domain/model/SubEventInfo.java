package fr.lapetina.primaryserver.domain.model;

/**
 * Positional metadata attached to every chunk.
 *
 * @param eventId     1-based event ordinal, or {@link #NO_MORE_EVENTS} on the exhaustion signal
 * @param maxEvents   event budget of the current generation cycle
 * @param part        1-based part number within the event
 * @param nparts      total number of parts of the event
 * @param seed        seed the worker initializes its transport engine with
 * @param startOffset offset of the chunk's first particle within the event
 * @param header      copy of the event header
 */
public record SubEventInfo(
        int eventId,
        int maxEvents,
        int part,
        int nparts,
        long seed,
        int startOffset,
        EventHeader header
) {
    public static final int NO_MORE_EVENTS = -1;
}
