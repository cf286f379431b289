package com.avari.signaling;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "app.relay.exit-on-fatal-fault=false")
class SignalingBackendApplicationTests {

    private final ObjectMapper mapper = new ObjectMapper();

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void healthReportsOk() throws Exception {
        ResponseEntity<String> response = restTemplate.getForEntity("/health", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode body = mapper.readTree(response.getBody());
        assertThat(body.path("status").asText()).isEqualTo("ok");
        assertThat(body.path("stats").path("activeMatches").asInt()).isZero();
    }

    @Test
    void iceServersListsStunByDefault() throws Exception {
        ResponseEntity<String> response = restTemplate.getForEntity("/api/ice-servers", String.class);

        JsonNode servers = mapper.readTree(response.getBody()).path("iceServers");
        assertThat(servers.size()).isGreaterThanOrEqualTo(3);
        assertThat(servers.get(0).path("urls").asText()).startsWith("stun:");
    }

    @Test
    void twoClientsCanRingEachOther() throws Exception {
        Client alice = connect();
        Client bob = connect();

        alice.send("{\"event\":\"register\",\"data\":{\"userId\":\"alice\",\"matchId\":\"it-match\"}}");
        assertThat(alice.next().path("event").asText()).isEqualTo("joined");

        bob.send("{\"event\":\"register\",\"data\":{\"userId\":\"bob\",\"matchId\":\"it-match\"}}");
        assertThat(bob.next().path("data").path("participantCount").asInt()).isEqualTo(2);
        assertThat(alice.next().path("event").asText()).isEqualTo("user-joined");

        alice.send("{\"event\":\"initiate-call\",\"data\":{\"to\":\"bob\"}}");
        JsonNode ring = bob.next();
        assertThat(ring.path("event").asText()).isEqualTo("incoming-call");
        assertThat(ring.path("data").path("from").asText()).isEqualTo("alice");

        ResponseEntity<String> match = restTemplate.getForEntity("/api/stats/matches/it-match", String.class);
        assertThat(match.getStatusCode()).isEqualTo(HttpStatus.OK);

        bob.session.close();
        assertThat(alice.next().path("event").asText()).isEqualTo("user-left");
        assertThat(alice.next().path("event").asText()).isEqualTo("call-ended");
        alice.session.close();
    }

    private Client connect() throws Exception {
        Client client = new Client();
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.setOrigin("http://localhost:3000");
        client.session = new StandardWebSocketClient()
                .execute(client, headers, URI.create("ws://localhost:" + port + "/ws/signaling"))
                .get(5, TimeUnit.SECONDS);
        return client;
    }

    private final class Client extends TextWebSocketHandler {
        private final BlockingQueue<String> received = new LinkedBlockingQueue<>();
        private WebSocketSession session;

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            received.add(message.getPayload());
        }

        void send(String json) throws Exception {
            session.sendMessage(new TextMessage(json));
        }

        JsonNode next() throws Exception {
            String payload = received.poll(5, TimeUnit.SECONDS);
            assertThat(payload).as("message within timeout").isNotNull();
            return mapper.readTree(payload);
        }
    }
}
