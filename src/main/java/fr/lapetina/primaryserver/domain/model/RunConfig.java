package fr.lapetina.primaryserver.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Parameters of one generation cycle.
 * Immutable and thread-safe; replaced wholesale on reconfiguration.
 *
 * @param generator        generator registry name
 * @param trigger          trigger expression applied to generated events, may be empty
 * @param mcEngine         transport engine the workers should construct
 * @param chunkSize        maximum number of primaries per chunk
 * @param seed             initial seed; chunk seeds are derived from it
 * @param nEvents          number of events to serve in this cycle
 * @param embedIntoFile    background event source to embed into, or null
 * @param extKinFile       external kinematics source, or null
 * @param generatorOptions generator specific options, kept sorted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunConfig(
        String generator,
        String trigger,
        String mcEngine,
        int chunkSize,
        long seed,
        int nEvents,
        String embedIntoFile,
        String extKinFile,
        Map<String, String> generatorOptions
) {
    public RunConfig {
        Objects.requireNonNull(generator, "Generator is required");
        if (chunkSize < 1) {
            throw new IllegalArgumentException("Chunk size must be at least 1, got " + chunkSize);
        }
        if (nEvents < 0) {
            throw new IllegalArgumentException("Number of events must not be negative, got " + nEvents);
        }
        if (trigger == null) {
            trigger = "";
        }
        SortedMap<String, String> sorted = new TreeMap<>();
        if (generatorOptions != null) {
            sorted.putAll(generatorOptions);
        }
        generatorOptions = Collections.unmodifiableSortedMap(sorted);
    }

    /**
     * Returns the given option, or the fallback when unset.
     */
    public String option(String key, String fallback) {
        return generatorOptions.getOrDefault(key, fallback);
    }

    public Builder toBuilder() {
        return new Builder()
                .generator(generator)
                .trigger(trigger)
                .mcEngine(mcEngine)
                .chunkSize(chunkSize)
                .seed(seed)
                .nEvents(nEvents)
                .embedIntoFile(embedIntoFile)
                .extKinFile(extKinFile)
                .generatorOptions(generatorOptions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String generator = "boxgen";
        private String trigger = "";
        private String mcEngine = "accounting";
        private int chunkSize = 500;
        private long seed = -1;
        private int nEvents = 1;
        private String embedIntoFile;
        private String extKinFile;
        private Map<String, String> generatorOptions = Map.of();

        public Builder generator(String generator) {
            this.generator = generator;
            return this;
        }

        public Builder trigger(String trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder mcEngine(String mcEngine) {
            this.mcEngine = mcEngine;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder nEvents(int nEvents) {
            this.nEvents = nEvents;
            return this;
        }

        public Builder embedIntoFile(String embedIntoFile) {
            this.embedIntoFile = embedIntoFile;
            return this;
        }

        public Builder extKinFile(String extKinFile) {
            this.extKinFile = extKinFile;
            return this;
        }

        public Builder generatorOptions(Map<String, String> generatorOptions) {
            this.generatorOptions = generatorOptions;
            return this;
        }

        public RunConfig build() {
            return new RunConfig(
                    generator, trigger, mcEngine, chunkSize, seed, nEvents,
                    embedIntoFile, extKinFile, generatorOptions
            );
        }
    }
}
