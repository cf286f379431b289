package com.avari.signaling.lifecycle;

import com.avari.signaling.signaling.SignalingWebSocketHandler;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class RelayShutdownLifecycleTest {

    private final SignalingWebSocketHandler handler = mock(SignalingWebSocketHandler.class);
    private final RelayShutdownLifecycle lifecycle = new RelayShutdownLifecycle(handler);

    @Test
    void broadcastsOnceOnStop() {
        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();

        lifecycle.stop();
        lifecycle.stop();

        verify(handler, times(1)).broadcastShutdown();
        assertThat(lifecycle.isRunning()).isFalse();
    }

    @Test
    void stopBeforeStartDoesNothing() {
        lifecycle.stop();

        verifyNoInteractions(handler);
    }
}
