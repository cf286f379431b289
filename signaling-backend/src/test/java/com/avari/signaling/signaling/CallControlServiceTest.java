package com.avari.signaling.signaling;

import com.avari.signaling.error.UserOfflineException;
import com.avari.signaling.error.ValidationException;
import com.avari.signaling.match.MatchRegistry;
import com.avari.signaling.support.MutableClock;
import com.avari.signaling.support.RecordingWebSocketSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.avari.signaling.support.TestConnections.connection;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallControlServiceTest {

    private MatchRegistry registry;
    private CallControlService callControl;

    private RecordingWebSocketSession sessionA;
    private RecordingWebSocketSession sessionB;
    private ClientConnection a;
    private ClientConnection b;

    @BeforeEach
    void setUp() {
        registry = new MatchRegistry(new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
        callControl = new CallControlService(registry);
        sessionA = new RecordingWebSocketSession("a");
        sessionB = new RecordingWebSocketSession("b");
        a = connection(sessionA);
        b = connection(sessionB);
        registry.register(a, "u1", "m1");
        registry.register(b, "u2", "m1");
        sessionA.clear();
        sessionB.clear();
    }

    @Test
    void initiateRingsTheTargetAndAcceptReachesTheCaller() {
        callControl.initiate(a, "u2");

        assertThat(sessionB.eventNames()).containsExactly("incoming-call");
        assertThat(sessionB.lastData("incoming-call").path("from").asText()).isEqualTo("u1");

        callControl.accept(b, "u1");

        assertThat(sessionA.eventNames()).containsExactly("call-accepted");
        assertThat(sessionA.lastData("call-accepted").path("from").asText()).isEqualTo("u2");
    }

    @Test
    void initiateToOfflineUserFails() {
        assertThatThrownBy(() -> callControl.initiate(a, "ghost"))
                .isInstanceOf(UserOfflineException.class);
        assertThat(sessionB.sentMessages()).isEmpty();
    }

    @Test
    void initiateToClosedConnectionFails() {
        sessionB.drop();

        assertThatThrownBy(() -> callControl.initiate(a, "u2"))
                .isInstanceOf(UserOfflineException.class);
    }

    @Test
    void initiateWithoutTargetIsValidationError() {
        assertThatThrownBy(() -> callControl.initiate(a, " "))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void unregisteredSenderIsValidationError() {
        ClientConnection stranger = connection(new RecordingWebSocketSession("x"));

        assertThatThrownBy(() -> callControl.initiate(stranger, "u2"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not registered");
    }

    @Test
    void acceptRejectAndEndToOfflineTargetsAreSilent() {
        RecordingWebSocketSession loneSession = new RecordingWebSocketSession("c");
        ClientConnection lone = connection(loneSession);
        registry.register(lone, "u3", "m2");
        loneSession.clear();

        assertThatCode(() -> {
            callControl.accept(lone, "ghost");
            callControl.reject(lone, "ghost", null);
            callControl.end(lone, "ghost");
        }).doesNotThrowAnyException();

        assertThat(loneSession.sentMessages()).isEmpty();
        assertThat(sessionA.sentMessages()).isEmpty();
        assertThat(sessionB.sentMessages()).isEmpty();
    }

    @Test
    void rejectUsesDefaultReason() {
        callControl.reject(b, "u1", null);

        assertThat(sessionA.lastData("call-rejected").path("from").asText()).isEqualTo("u2");
        assertThat(sessionA.lastData("call-rejected").path("reason").asText()).isEqualTo("User declined");
    }

    @Test
    void rejectForwardsGivenReason() {
        callControl.reject(b, "u1", "busy");

        assertThat(sessionA.lastData("call-rejected").path("reason").asText()).isEqualTo("busy");
    }

    @Test
    void endNotifiesDirectTargetOnlyOnceWhenAlsoInMatch() {
        callControl.end(a, "u2");

        assertThat(sessionB.eventNames()).containsExactly("call-ended");
        assertThat(sessionB.lastData("call-ended").path("from").asText()).isEqualTo("u1");
        assertThat(sessionA.sentMessages()).isEmpty();
    }

    @Test
    void endWithoutTargetBroadcastsToMatch() {
        callControl.end(a, null);

        assertThat(sessionB.eventNames()).containsExactly("call-ended");
    }

    @Test
    void endReachesNamedTargetOutsideMatchAndMatchPeer() {
        RecordingWebSocketSession otherSession = new RecordingWebSocketSession("c");
        ClientConnection other = connection(otherSession);
        registry.register(other, "u3", "m2");
        otherSession.clear();

        callControl.end(a, "u3");

        assertThat(otherSession.eventNames()).containsExactly("call-ended");
        assertThat(sessionB.eventNames()).containsExactly("call-ended");
    }
}
