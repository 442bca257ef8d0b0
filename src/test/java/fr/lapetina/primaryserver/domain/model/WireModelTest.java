package fr.lapetina.primaryserver.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WireModelTest {

    @Test
    @DisplayName("should map lifecycle states to stable wire codes")
    void shouldMapLifecycleCodes() {
        assertThat(LifecycleState.values()).extracting(LifecycleState::getCode).containsExactly(0, 1, 2, 3, 4);
        assertThat(LifecycleState.fromCode(3)).contains(LifecycleState.IDLE);
        assertThat(LifecycleState.fromCode(9)).isEmpty();
        assertThat(LifecycleState.IDLE.acceptsWorkRequests()).isFalse();
        assertThat(LifecycleState.STOPPED.acceptsWorkRequests()).isFalse();
        assertThat(LifecycleState.WAITING_EVENT.acceptsWorkRequests()).isTrue();
    }

    @Test
    @DisplayName("should recognize request tokens only by exact value")
    void shouldRecognizeTokens() {
        assertThat(RequestToken.fromWire("config-request")).contains(RequestToken.CONFIG_REQUEST);
        assertThat(RequestToken.fromWire("work-request\n")).contains(RequestToken.WORK_REQUEST);
        assertThat(RequestToken.fromWire("WORK-REQUEST")).isEmpty();
        assertThat(RequestToken.fromWire(null)).isEmpty();
    }

    @Test
    @DisplayName("should validate run configurations")
    void shouldValidateRunConfig() {
        RunConfig defaults = RunConfig.builder().build();

        assertThat(defaults.generator()).isEqualTo("boxgen");
        assertThat(defaults.chunkSize()).isEqualTo(500);
        assertThat(defaults.seed()).isEqualTo(-1);
        assertThat(defaults.nEvents()).isEqualTo(1);
        assertThatThrownBy(() -> RunConfig.builder().chunkSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RunConfig.builder().nEvents(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should map error types to HTTP statuses")
    void shouldMapErrorTypes() {
        assertThat(ErrorType.PROTOCOL_VIOLATION.getHttpStatus()).isEqualTo(400);
        assertThat(ErrorType.GENERATION_FAILED.getHttpStatus()).isEqualTo(500);
        assertThat(ErrorType.UNAVAILABLE.getHttpStatus()).isEqualTo(503);
        assertThat(ErrorType.TIMEOUT.getHttpStatus()).isEqualTo(504);
        assertThat(new ErrorReply(ErrorType.TIMEOUT, null).message()).isEqualTo("TIMEOUT");
    }
}
