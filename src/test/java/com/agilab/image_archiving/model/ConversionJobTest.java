package com.agilab.image_archiving.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversionJobTest {

    private final ConversionJob pending = ConversionJob.pending(Path.of("/a/x_001.cr2"), Path.of("/a/x_001.dng"));

    @Test
    void shouldMoveFromPendingThroughRunningToSucceeded() {
        var running = pending.running();
        var succeeded = running.succeeded(0);

        assertThat(pending.state()).isEqualTo(ConversionState.PENDING);
        assertThat(running.state()).isEqualTo(ConversionState.RUNNING);
        assertThat(succeeded.state()).isEqualTo(ConversionState.SUCCEEDED);
        assertThat(succeeded.isTerminal()).isTrue();
    }

    @Test
    void shouldAllowFailingBeforeRunning() {
        var failed = pending.failed(FailureKind.TOOL_MISSING, "dnglab not found");

        assertThat(failed.state()).isEqualTo(ConversionState.FAILED);
        assertThat(failed.exitCode()).isNull();
    }

    @Test
    void shouldRejectTransitionsOutOfTerminalStates() {
        var succeeded = pending.running().succeeded(0);
        var failed = pending.running().failed(FailureKind.CONVERSION_FAILED, 1, "invalid file");

        assertThatThrownBy(() -> succeeded.failed(FailureKind.TIMEOUT, "late")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(failed::running).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> pending.succeeded(0)).isInstanceOf(IllegalStateException.class);
    }
}
