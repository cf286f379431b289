package com.avari.signaling.webrtc;

import com.avari.signaling.config.IceServerProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the ICE server list handed to browsers: public STUN servers, then
 * TURN relays from Metered credentials or, failing that, a custom TURN server.
 */
@Component
public class IceServerCatalog {

    private final IceServerProperties properties;

    public IceServerCatalog(IceServerProperties properties) {
        this.properties = properties;
    }

    public List<IceServer> iceServers() {
        List<IceServer> servers = new ArrayList<>();
        for (String url : properties.stunUrls()) {
            servers.add(IceServer.stun(url));
        }

        if (properties.hasMeteredCredentials()) {
            String host = properties.meteredHost();
            String username = properties.meteredUsername();
            String credential = properties.meteredCredential();
            servers.add(IceServer.turn("turn:" + host + ":80", username, credential));
            servers.add(IceServer.turn("turn:" + host + ":80?transport=tcp", username, credential));
            servers.add(IceServer.turn("turn:" + host + ":443", username, credential));
            servers.add(IceServer.turn("turn:" + host + ":443?transport=tcp", username, credential));
        } else if (properties.hasCustomTurn()) {
            servers.add(IceServer.turn(
                    properties.turnUrl(),
                    nullToEmpty(properties.turnUsername()),
                    nullToEmpty(properties.turnCredential())));
        }
        return servers;
    }

    public boolean hasTurn() {
        return properties.hasMeteredCredentials() || properties.hasCustomTurn();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
