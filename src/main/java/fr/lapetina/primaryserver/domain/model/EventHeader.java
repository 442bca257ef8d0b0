package fr.lapetina.primaryserver.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Summary metadata of one generated event.
 * Copied into every chunk cut from the event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventHeader(
        String generator,
        int numberOfPrimaries,
        long seed,
        String embeddedInto,
        Instant generatedAt,
        Map<String, String> info
) {
    public EventHeader {
        SortedMap<String, String> sorted = new TreeMap<>();
        if (info != null) {
            sorted.putAll(info);
        }
        info = Collections.unmodifiableSortedMap(sorted);
    }

    /**
     * Header carried by chunks when no event has been produced yet.
     */
    public static EventHeader empty() {
        return new EventHeader(null, 0, 0, null, null, null);
    }

    public EventHeader withPrimaries(int numberOfPrimaries) {
        return new EventHeader(generator, numberOfPrimaries, seed, embeddedInto, generatedAt, info);
    }
}
