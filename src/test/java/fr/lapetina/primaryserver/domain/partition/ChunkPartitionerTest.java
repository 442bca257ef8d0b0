package fr.lapetina.primaryserver.domain.partition;

import fr.lapetina.primaryserver.domain.model.EventHeader;
import fr.lapetina.primaryserver.domain.model.Particle;
import fr.lapetina.primaryserver.domain.model.PrimaryChunk;
import fr.lapetina.primaryserver.domain.model.PrimaryEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkPartitionerTest {

    private static PrimaryEvent event(int size) {
        List<Particle> particles = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            particles.add(Particle.atOrigin(i, 0, 0, 1, 1));
        }
        return new PrimaryEvent(particles, new EventHeader("test", size, 5, null, null, null));
    }

    @Nested
    @DisplayName("slicing")
    class Slicing {

        @Test
        @DisplayName("should slice back to front")
        void shouldSliceBackToFront() {
            assertThat(ChunkPartitioner.numberOfParts(1200, 500)).isEqualTo(3);
            assertThat(ChunkPartitioner.slice(1200, 500, 0)).isEqualTo(new ChunkPartitioner.Slice(700, 1200));
            assertThat(ChunkPartitioner.slice(1200, 500, 1)).isEqualTo(new ChunkPartitioner.Slice(200, 700));
            assertThat(ChunkPartitioner.slice(1200, 500, 2)).isEqualTo(new ChunkPartitioner.Slice(0, 200));
        }

        @Test
        @DisplayName("should produce one empty part for an empty event")
        void shouldProduceOnePartForEmptyEvent() {
            assertThat(ChunkPartitioner.numberOfParts(0, 500)).isEqualTo(1);
            assertThat(ChunkPartitioner.slice(0, 500, 0).length()).isZero();
        }

        @Test
        @DisplayName("should produce exact parts when size divides evenly")
        void shouldProduceExactParts() {
            assertThat(ChunkPartitioner.numberOfParts(1000, 500)).isEqualTo(2);
            assertThat(ChunkPartitioner.slice(1000, 500, 1)).isEqualTo(new ChunkPartitioner.Slice(0, 500));
        }

        @Test
        @DisplayName("should count parts of events near the int limit")
        void shouldCountPartsOfHugeEvents() {
            assertThat(ChunkPartitioner.numberOfParts(Integer.MAX_VALUE, 10)).isEqualTo(214_748_365);
            assertThat(ChunkPartitioner.numberOfParts(Integer.MAX_VALUE, Integer.MAX_VALUE)).isEqualTo(1);
            assertThat(ChunkPartitioner.numberOfParts(Integer.MAX_VALUE - 1, Integer.MAX_VALUE)).isEqualTo(1);
            assertThat(ChunkPartitioner.slice(Integer.MAX_VALUE, 10, 214_748_364))
                    .isEqualTo(new ChunkPartitioner.Slice(0, 7));
        }

        @Test
        @DisplayName("should cover every index exactly once for small sizes")
        void shouldCoverEveryIndexForSmallSizes() {
            for (int particles = 0; particles <= 60; particles++) {
                for (int chunkSize = 1; chunkSize <= 15; chunkSize++) {
                    int nparts = ChunkPartitioner.numberOfParts(particles, chunkSize);
                    assertThat(nparts)
                            .as("parts of N=%d C=%d", particles, chunkSize)
                            .isEqualTo(Math.max(1, (particles + chunkSize - 1) / chunkSize));

                    int[] hits = new int[particles];
                    int expectedEnd = particles;
                    for (int part = 0; part < nparts; part++) {
                        ChunkPartitioner.Slice slice = ChunkPartitioner.slice(particles, chunkSize, part);
                        assertThat(slice.end())
                                .as("contiguous N=%d C=%d part=%d", particles, chunkSize, part)
                                .isEqualTo(expectedEnd);
                        assertThat(slice.length()).isBetween(0, chunkSize);
                        for (int i = slice.start(); i < slice.end(); i++) {
                            hits[i]++;
                        }
                        expectedEnd = slice.start();
                    }
                    assertThat(expectedEnd).as("reaches index 0 for N=%d C=%d", particles, chunkSize).isZero();
                    assertThat(Arrays.stream(hits).allMatch(h -> h == 1))
                            .as("each index once for N=%d C=%d", particles, chunkSize)
                            .isTrue();
                }
            }
        }

        @Test
        @DisplayName("should reject invalid arguments")
        void shouldRejectInvalidArguments() {
            assertThatThrownBy(() -> ChunkPartitioner.numberOfParts(10, 0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ChunkPartitioner.numberOfParts(-1, 10))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ChunkPartitioner.slice(10, 5, -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("chunking")
    class Chunking {

        @Test
        @DisplayName("should cover every particle exactly once")
        void shouldCoverEveryParticleOnce() {
            PrimaryEvent event = event(1234);

            List<PrimaryChunk> chunks = ChunkPartitioner.partition(event, 100, 1, 1, 0);

            List<Particle> reassembled = new ArrayList<>();
            for (int i = chunks.size() - 1; i >= 0; i--) {
                reassembled.addAll(chunks.get(i).particles());
            }
            assertThat(chunks).hasSize(13);
            assertThat(reassembled).isEqualTo(event.getParticles());
        }

        @Test
        @DisplayName("should number parts from one and derive the chunk seed")
        void shouldFillSubEventInfo() {
            List<PrimaryChunk> chunks = ChunkPartitioner.partition(event(1200), 500, 2, 4, 42);

            assertThat(chunks).extracting(c -> c.info().part()).containsExactly(1, 2, 3);
            assertThat(chunks).extracting(c -> c.info().startOffset()).containsExactly(700, 200, 0);
            assertThat(chunks).allSatisfy(c -> {
                assertThat(c.info().eventId()).isEqualTo(2);
                assertThat(c.info().maxEvents()).isEqualTo(4);
                assertThat(c.info().nparts()).isEqualTo(3);
                assertThat(c.info().seed()).isEqualTo(44);
                assertThat(c.info().header().numberOfPrimaries()).isEqualTo(1200);
            });
            assertThat(chunks.get(0).particles().get(0).pdg()).isEqualTo(700);
        }

        @Test
        @DisplayName("should not mistake an empty event for exhaustion")
        void shouldNotMistakeEmptyEventForExhaustion() {
            PrimaryChunk chunk = ChunkPartitioner.chunk(event(0), 500, 0, 1, 1, 0);

            assertThat(chunk.particles()).isEmpty();
            assertThat(chunk.info().nparts()).isEqualTo(1);
            assertThat(chunk.isExhaustionSignal()).isFalse();
        }
    }
}
