package fr.lapetina.primaryserver.domain.generator;

import fr.lapetina.primaryserver.domain.model.PrimaryEvent;
import fr.lapetina.primaryserver.domain.model.RunConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeneratorCoordinatorTest {

    private GeneratorCoordinator coordinator;

    @BeforeAll
    static void registerTestGenerators() {
        SequenceGenerator.register();
    }

    @BeforeEach
    void setUp() {
        coordinator = new GeneratorCoordinator();
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    @Nested
    @DisplayName("generator cache")
    class Cache {

        @Test
        @DisplayName("should reuse the instance for an identical configuration")
        void shouldReuseInstanceForSameKey() {
            RunConfig config = SequenceGenerator.config(10, 5, 1, 1);

            Generator first = coordinator.initialize(config);
            Generator second = coordinator.initialize(config.toBuilder().seed(99).nEvents(3).build());

            assertThat(second).isSameAs(first);
            assertThat(coordinator.cacheSize()).isEqualTo(1);
        }

        @Test
        @DisplayName("should construct a new instance when generator options differ")
        void shouldConstructNewInstanceForDifferentOptions() {
            RunConfig config = SequenceGenerator.config(10, 5, 1, 1);
            int initsBefore = SequenceGenerator.INIT_COUNT.get();

            Generator first = coordinator.initialize(config);
            Generator second = coordinator.initialize(SequenceGenerator.config(20, 5, 1, 1));

            assertThat(second).isNotSameAs(first);
            assertThat(coordinator.cacheSize()).isEqualTo(2);
            assertThat(SequenceGenerator.INIT_COUNT.get() - initsBefore).isEqualTo(2);
        }

        @Test
        @DisplayName("should match generator names case-insensitively")
        void shouldMatchNamesCaseInsensitively() {
            RunConfig lower = RunConfig.builder().generator("boxgen").build();
            RunConfig upper = RunConfig.builder().generator("BoxGen").build();

            assertThat(coordinator.initialize(upper)).isSameAs(coordinator.initialize(lower));
        }

        @Test
        @DisplayName("should never cache external kinematics generators")
        void shouldNeverCacheExternalKinematics(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("events.txt");
            Files.writeString(file, "# event 1\n211 0.1 0.2 0.3 1.0\n");
            RunConfig config = RunConfig.builder()
                    .generator(TextKinematicsGenerator.NAME)
                    .extKinFile(file.toString())
                    .build();

            Generator first = coordinator.initialize(config);
            Generator second = coordinator.initialize(config);

            assertThat(second).isNotSameAs(first);
            assertThat(coordinator.cacheSize()).isZero();
            assertThat(GeneratorFactory.isCacheable("extkinO2")).isFalse();
            assertThat(GeneratorFactory.isCacheable("boxgen")).isTrue();
        }

        @Test
        @DisplayName("should fail for an unknown generator name")
        void shouldFailForUnknownGenerator() {
            RunConfig config = RunConfig.builder().generator("no-such-generator").build();

            assertThatThrownBy(() -> coordinator.initialize(config))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("no-such-generator");
        }

        @Test
        @DisplayName("should fail when the embedding source is unreadable")
        void shouldFailForUnreadableEmbeddingSource(@TempDir Path dir) {
            RunConfig config = RunConfig.builder()
                    .generator("boxgen")
                    .embedIntoFile(dir.resolve("missing.root").toString())
                    .build();

            assertThatThrownBy(() -> coordinator.initialize(config))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("missing.root");
        }
    }

    @Nested
    @DisplayName("event production")
    class Production {

        @Test
        @DisplayName("should fill the header from generator and seed")
        void shouldFillHeader() {
            RunConfig config = SequenceGenerator.config(12, 5, 1, 17);
            coordinator.reseed(config.seed());

            PrimaryEvent event = coordinator.produceEvent(coordinator.initialize(config), config);

            assertThat(event.size()).isEqualTo(12);
            assertThat(event.getHeader().generator()).isEqualTo(SequenceGenerator.NAME);
            assertThat(event.getHeader().numberOfPrimaries()).isEqualTo(12);
            assertThat(event.getHeader().seed()).isEqualTo(17);
            assertThat(event.getHeader().generatedAt()).isNotNull();
        }

        @Test
        @DisplayName("should reproduce the same event for the same seed")
        void shouldBeReproducibleForSameSeed() {
            RunConfig config = RunConfig.builder()
                    .generator("boxgen")
                    .generatorOptions(Map.of("multiplicity", "50"))
                    .build();
            Generator generator = coordinator.initialize(config);

            coordinator.reseed(1234);
            PrimaryEvent first = coordinator.produceEvent(generator, config);
            coordinator.reseed(1234);
            PrimaryEvent second = coordinator.produceEvent(generator, config);

            assertThat(second.getParticles()).isEqualTo(first.getParticles());
        }

        @Test
        @DisplayName("should resolve a negative seed to a fresh positive one")
        void shouldResolveNegativeSeed() {
            long seed = coordinator.reseed(-1);

            assertThat(seed).isPositive();
            assertThat(coordinator.getCurrentSeed()).isEqualTo(seed);
        }

        @Test
        @DisplayName("should give up when the trigger rejects every event")
        void shouldGiveUpWhenTriggerRejectsEverything() {
            RunConfig config = SequenceGenerator.config(3, 5, 1, 1).toBuilder()
                    .trigger("min-primaries:10")
                    .build();

            assertThatThrownBy(() -> coordinator.produceEvent(coordinator.initialize(config), config))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("min-primaries:10");
        }

        @Test
        @DisplayName("should accept events passing the trigger")
        void shouldAcceptEventsPassingTrigger() {
            RunConfig config = SequenceGenerator.config(3, 5, 1, 1).toBuilder()
                    .trigger("max-primaries:3")
                    .build();

            assertThat(coordinator.produceEvent(coordinator.initialize(config), config).size()).isEqualTo(3);
        }
    }
}
