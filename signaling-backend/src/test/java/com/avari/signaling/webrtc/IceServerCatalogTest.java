package com.avari.signaling.webrtc;

import com.avari.signaling.config.IceServerProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class IceServerCatalogTest {

    private static final List<String> STUN = List.of(
            "stun:stun.l.google.com:19302",
            "stun:stun1.l.google.com:19302",
            "stun:stun2.l.google.com:19302");

    @Test
    void stunOnlyWithoutTurnSettings() {
        IceServerCatalog catalog = new IceServerCatalog(
                new IceServerProperties(STUN, "a.relay.metered.ca", null, null, null, null, null));

        assertThat(catalog.iceServers()).extracting(IceServer::urls).containsExactlyElementsOf(STUN);
        assertThat(catalog.iceServers()).allSatisfy(server -> assertThat(server.username()).isNull());
        assertThat(catalog.hasTurn()).isFalse();
    }

    @Test
    void meteredCredentialsAddFourRelays() {
        IceServerCatalog catalog = new IceServerCatalog(
                new IceServerProperties(STUN, "a.relay.metered.ca", "user", "pass", "turn:custom:3478", "x", "y"));

        List<IceServer> servers = catalog.iceServers();

        assertThat(servers).hasSize(7);
        assertThat(servers.subList(3, 7))
                .extracting(IceServer::urls, IceServer::username, IceServer::credential)
                .containsExactly(
                        tuple("turn:a.relay.metered.ca:80", "user", "pass"),
                        tuple("turn:a.relay.metered.ca:80?transport=tcp", "user", "pass"),
                        tuple("turn:a.relay.metered.ca:443", "user", "pass"),
                        tuple("turn:a.relay.metered.ca:443?transport=tcp", "user", "pass"));
        assertThat(catalog.hasTurn()).isTrue();
    }

    @Test
    void customTurnUsedWhenMeteredIncomplete() {
        IceServerCatalog catalog = new IceServerCatalog(
                new IceServerProperties(STUN, "a.relay.metered.ca", "user", null, "turn:turn.example.com:3478", null, null));

        List<IceServer> servers = catalog.iceServers();

        assertThat(servers).hasSize(4);
        assertThat(servers.get(3)).isEqualTo(new IceServer("turn:turn.example.com:3478", "", ""));
    }
}
