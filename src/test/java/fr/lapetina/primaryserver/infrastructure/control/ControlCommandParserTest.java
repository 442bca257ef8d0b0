package fr.lapetina.primaryserver.infrastructure.control;

import fr.lapetina.primaryserver.domain.model.ReconfigRequest;
import fr.lapetina.primaryserver.domain.model.RunConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ControlCommandParserTest {

    @Test
    @DisplayName("should parse a full reconfiguration command")
    void shouldParseFullCommand() {
        ReconfigRequest request = ControlCommandParser.parse(
                "--generator extkin --extKinFile \"/data/my events.txt\" --startSeed 12 --nEvents 4 --chunkSize 250");

        assertThat(request.stop()).isFalse();
        assertThat(request.generator()).isEqualTo("extkin");
        assertThat(request.extKinFile()).isEqualTo("/data/my events.txt");
        assertThat(request.startSeed()).isEqualTo(12L);
        assertThat(request.nEvents()).isEqualTo(4);
        assertThat(request.chunkSize()).isEqualTo(250);
        assertThat(request.trigger()).isNull();
    }

    @Test
    @DisplayName("should keep unset fields when applied")
    void shouldKeepUnsetFieldsWhenApplied() {
        RunConfig base = RunConfig.builder().generator("boxgen").chunkSize(100).nEvents(3).seed(5).build();

        RunConfig next = ControlCommandParser.parse("-n 7 --seed 9").applyTo(base);

        assertThat(next.generator()).isEqualTo("boxgen");
        assertThat(next.chunkSize()).isEqualTo(100);
        assertThat(next.nEvents()).isEqualTo(7);
        assertThat(next.seed()).isEqualTo(9);
    }

    @Test
    @DisplayName("should parse a stop command")
    void shouldParseStop() {
        assertThat(ControlCommandParser.parse("  --stop ").stop()).isTrue();
    }

    @Test
    @DisplayName("should reject empty and unknown commands")
    void shouldRejectInvalidCommands() {
        assertThatThrownBy(() -> ControlCommandParser.parse(" "))
                .isInstanceOf(ControlCommandException.class)
                .hasMessage("Empty control command");
        assertThatThrownBy(() -> ControlCommandParser.parse("--colour blue"))
                .isInstanceOf(ControlCommandException.class)
                .hasMessage("Unknown option: --colour");
        assertThatThrownBy(() -> ControlCommandParser.parse("--generator --nEvents 3"))
                .isInstanceOf(ControlCommandException.class)
                .hasMessage("Missing value for --generator");
        assertThatThrownBy(() -> ControlCommandParser.parse("--nEvents"))
                .isInstanceOf(ControlCommandException.class);
        assertThatThrownBy(() -> ControlCommandParser.parse("--startSeed abc"))
                .isInstanceOf(ControlCommandException.class)
                .hasMessageContaining("Invalid number");
        assertThatThrownBy(() -> ControlCommandParser.parse("--nEvents -1"))
                .isInstanceOf(ControlCommandException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> ControlCommandParser.parse("--trigger \"min-primaries:3"))
                .isInstanceOf(ControlCommandException.class)
                .hasMessageContaining("Unterminated quote");
    }

    @Test
    @DisplayName("should tokenize quoted and empty arguments")
    void shouldTokenizeQuotedArguments() {
        assertThat(ControlCommandParser.tokenize("--trigger \"\" --generator  boxgen"))
                .containsExactly("--trigger", "", "--generator", "boxgen");
    }
}
