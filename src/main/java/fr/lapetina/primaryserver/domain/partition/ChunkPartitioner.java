package fr.lapetina.primaryserver.domain.partition;

import fr.lapetina.primaryserver.domain.model.PrimaryChunk;
import fr.lapetina.primaryserver.domain.model.PrimaryEvent;
import fr.lapetina.primaryserver.domain.model.SubEventInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts events into chunks.
 *
 * Parts are sliced back to front: part 1 holds the last {@code chunkSize}
 * primaries of the event, part 2 the ones before, and so on. Downstream
 * consumers rely on this ordering.
 */
public final class ChunkPartitioner {

    private ChunkPartitioner() {
        // Utility class
    }

    /**
     * Half-open particle range {@code [start, end)} of one part.
     */
    public record Slice(int start, int end) {
        public int length() {
            return end - start;
        }
    }

    /**
     * Number of parts of an event; at least 1, even for an empty event.
     */
    public static int numberOfParts(int particleCount, int chunkSize) {
        requireValid(particleCount, chunkSize);
        long parts = ((long) particleCount + chunkSize - 1) / chunkSize;
        return (int) Math.max(1, parts);
    }

    /**
     * Range of the part with the given 0-based index.
     */
    public static Slice slice(int particleCount, int chunkSize, int partIndex) {
        requireValid(particleCount, chunkSize);
        if (partIndex < 0) {
            throw new IllegalArgumentException("Part index must not be negative: " + partIndex);
        }
        long end = (long) particleCount - (long) partIndex * chunkSize;
        long start = (long) particleCount - (long) (partIndex + 1) * chunkSize;
        return new Slice(clamp(start, particleCount), clamp(end, particleCount));
    }

    /**
     * Builds the chunk of the given 0-based part.
     *
     * @param event       the event being served
     * @param chunkSize   configured chunk size
     * @param partIndex   0-based part index
     * @param eventId     1-based event ordinal
     * @param maxEvents   event budget
     * @param initialSeed seed of the generation cycle
     */
    public static PrimaryChunk chunk(
            PrimaryEvent event,
            int chunkSize,
            int partIndex,
            int eventId,
            int maxEvents,
            long initialSeed
    ) {
        int nparts = numberOfParts(event.size(), chunkSize);
        Slice slice = slice(event.size(), chunkSize, partIndex);
        SubEventInfo info = new SubEventInfo(
                eventId,
                maxEvents,
                partIndex + 1,
                nparts,
                eventId + initialSeed,
                slice.start(),
                event.getHeader()
        );
        return new PrimaryChunk(info, event.slice(slice.start(), slice.end()));
    }

    /**
     * Cuts a whole event into its ordered sequence of chunks.
     */
    public static List<PrimaryChunk> partition(
            PrimaryEvent event,
            int chunkSize,
            int eventId,
            int maxEvents,
            long initialSeed
    ) {
        int nparts = numberOfParts(event.size(), chunkSize);
        List<PrimaryChunk> chunks = new ArrayList<>(nparts);
        for (int part = 0; part < nparts; part++) {
            chunks.add(chunk(event, chunkSize, part, eventId, maxEvents, initialSeed));
        }
        return chunks;
    }

    private static int clamp(long value, int particleCount) {
        if (value < 0) {
            return 0;
        }
        return (int) Math.min(value, particleCount);
    }

    private static void requireValid(int particleCount, int chunkSize) {
        if (particleCount < 0) {
            throw new IllegalArgumentException("Particle count must not be negative: " + particleCount);
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("Chunk size must be at least 1: " + chunkSize);
        }
    }
}
