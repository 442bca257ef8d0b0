package fr.lapetina.primaryserver.infrastructure.config;

import fr.lapetina.primaryserver.domain.model.RunConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @Nested
    @DisplayName("loading")
    class Loading {

        @Test
        @DisplayName("should load the configuration from the classpath")
        void shouldLoadFromClasspath() {
            PrimaryServerConfig config = new ConfigLoader("test-config.yaml", Map.of()).load();

            assertThat(config.getServer().getHost()).isEqualTo("127.0.0.1");
            assertThat(config.getServer().getWorkPort()).isZero();
            assertThat(config.getRun().getNumberOfEvents()).isEqualTo(2);
            assertThat(config.getDisruptor().getRingBufferSize()).isEqualTo(64);
            assertThat(config.getMetrics().getPrefix()).isEqualTo("test_primserver");
        }

        @Test
        @DisplayName("should convert the run section with textual generator options")
        void shouldConvertRunSection() {
            RunConfig run = new ConfigLoader("test-config.yaml", Map.of()).load().getRun().toRunConfig();

            assertThat(run.generator()).isEqualTo("boxgen");
            assertThat(run.chunkSize()).isEqualTo(500);
            assertThat(run.seed()).isEqualTo(42);
            assertThat(run.nEvents()).isEqualTo(2);
            assertThat(run.generatorOptions()).containsEntry("multiplicity", "1200");
        }

        @Test
        @DisplayName("should prefer a file on disk")
        void shouldLoadFromFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("server.yaml");
            Files.writeString(file, "run:\n  generator: extkin\n  extKinFile: /tmp/events.txt\n");

            PrimaryServerConfig config = new ConfigLoader(file.toString(), Map.of()).load();

            assertThat(config.getRun().getGenerator()).isEqualTo("extkin");
            assertThat(config.getRun().getExtKinFile()).isEqualTo("/tmp/events.txt");
            assertThat(config.getRun().getChunkSize()).isEqualTo(500);
            assertThat(config.getServer().getWorkPort()).isEqualTo(8100);
        }

        @Test
        @DisplayName("should fall back to defaults for an empty document")
        void shouldUseDefaultsForEmptyDocument() {
            PrimaryServerConfig config = ConfigLoader.loadFromStream(
                    new ByteArrayInputStream(new byte[0]));

            assertThat(config.getRun().getGenerator()).isEqualTo("boxgen");
            assertThat(config.getService().isAsService()).isFalse();
        }

        @Test
        @DisplayName("should fail on missing files and invalid documents")
        void shouldFailOnInvalidInput(@TempDir Path dir) {
            assertThatThrownBy(() -> new ConfigLoader(dir.resolve("absent.yaml").toString(), Map.of()).load())
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("not found");
            assertThatThrownBy(() -> ConfigLoader.loadFile(dir.resolve("absent.yaml")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("not readable");
            assertThatThrownBy(() -> ConfigLoader.loadFromStream(new ByteArrayInputStream(
                    "run:\n  chunkSize: many\n".getBytes(StandardCharsets.UTF_8))))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Invalid configuration");
        }
    }

    @Nested
    @DisplayName("environment overrides")
    class Overrides {

        @Test
        @DisplayName("should override run and service settings")
        void shouldOverrideSettings() {
            PrimaryServerConfig config = new ConfigLoader("test-config.yaml", Map.of(
                    EnvironmentOverrides.GENERATOR, "extkinO2",
                    EnvironmentOverrides.NEVENTS, "9",
                    EnvironmentOverrides.SEED, " 77 ",
                    EnvironmentOverrides.AS_SERVICE, "1",
                    EnvironmentOverrides.DRIVER_PIPE, "5",
                    EnvironmentOverrides.CONTROL_TIMEOUT_MS, "2500"
            )).load();

            assertThat(config.getRun().getGenerator()).isEqualTo("extkinO2");
            assertThat(config.getRun().getNumberOfEvents()).isEqualTo(9);
            assertThat(config.getRun().getSeed()).isEqualTo(77);
            assertThat(config.getService().isAsService()).isTrue();
            assertThat(config.getService().getDriverPipe()).isEqualTo("5");
            assertThat(config.getService().getControlTimeoutMs()).isEqualTo(2500);
        }

        @Test
        @DisplayName("should ignore blank variables")
        void shouldIgnoreBlankVariables() {
            PrimaryServerConfig config = new ConfigLoader("test-config.yaml",
                    Map.of(EnvironmentOverrides.CHUNK_SIZE, "  ")).load();

            assertThat(config.getRun().getChunkSize()).isEqualTo(500);
        }

        @Test
        @DisplayName("should reject non numeric values")
        void shouldRejectNonNumericValues() {
            ConfigLoader loader = new ConfigLoader("test-config.yaml", Map.of(EnvironmentOverrides.CHUNK_SIZE, "big"));

            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining(EnvironmentOverrides.CHUNK_SIZE);
        }
    }
}
