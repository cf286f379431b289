package com.avari.signaling.signaling;

import com.avari.signaling.error.UserOfflineException;
import com.avari.signaling.error.ValidationException;
import com.avari.signaling.match.MatchRegistry;
import com.avari.signaling.support.MutableClock;
import com.avari.signaling.support.RecordingWebSocketSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.avari.signaling.support.TestConnections.connection;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignalingRouterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private MutableClock clock;
    private MatchRegistry registry;
    private SignalingRouter router;

    private RecordingWebSocketSession sessionA;
    private RecordingWebSocketSession sessionB;
    private ClientConnection a;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        registry = new MatchRegistry(clock);
        router = new SignalingRouter(registry);
        sessionA = new RecordingWebSocketSession("a");
        sessionB = new RecordingWebSocketSession("b");
        a = connection(sessionA);
        registry.register(a, "u1", "m1");
        registry.register(connection(sessionB), "u2", "m1");
        sessionA.clear();
        sessionB.clear();
    }

    @Test
    void offerPayloadIsForwardedUnchangedWithSender() throws Exception {
        JsonNode offer = mapper.readTree("{\"type\":\"offer\",\"sdp\":\"v=0\\r\\no=- 1 2 IN IP4 127.0.0.1\",\"extra\":[1,2]}");

        router.route(a, SignalKind.OFFER, "u2", offer);

        assertThat(sessionB.eventNames()).containsExactly("offer");
        JsonNode data = sessionB.lastData("offer");
        assertThat(data.path("offer")).isEqualTo(offer);
        assertThat(data.path("from").asText()).isEqualTo("u1");
    }

    @Test
    void candidateIsForwardedUnderCandidateField() throws Exception {
        JsonNode candidate = mapper.readTree("{\"candidate\":\"candidate:1 1 udp 2122260223 10.0.0.1 5000 typ host\",\"sdpMLineIndex\":0}");

        router.route(a, SignalKind.ICE_CANDIDATE, "u2", candidate);

        assertThat(sessionB.lastData("ice-candidate").path("candidate")).isEqualTo(candidate);
    }

    @Test
    void offerToOfflineUserIsReported() {
        assertThatThrownBy(() -> router.route(a, SignalKind.OFFER, "ghost", mapper.createObjectNode()))
                .isInstanceOf(UserOfflineException.class);
        assertThat(sessionB.sentMessages()).isEmpty();
    }

    @Test
    void offerWithoutTargetIsValidationError() {
        assertThatThrownBy(() -> router.route(a, SignalKind.OFFER, null, mapper.createObjectNode()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void answerAndCandidateToOfflineUserAreDropped() {
        router.route(a, SignalKind.ANSWER, "ghost", mapper.createObjectNode());
        router.route(a, SignalKind.ICE_CANDIDATE, "ghost", mapper.createObjectNode());
        router.route(a, SignalKind.ANSWER, null, mapper.createObjectNode());

        assertThat(sessionA.sentMessages()).isEmpty();
        assertThat(sessionB.sentMessages()).isEmpty();
    }

    @Test
    void routingRefreshesMatchActivity() {
        clock.advance(Duration.ofMinutes(7));

        router.route(a, SignalKind.ANSWER, "u2", mapper.createObjectNode());

        assertThat(registry.snapshot("m1").orElseThrow().lastActivityAt())
                .isEqualTo(Instant.parse("2024-01-01T00:07:00Z"));
    }
}
