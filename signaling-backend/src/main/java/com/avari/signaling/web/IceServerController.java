package com.avari.signaling.web;

import com.avari.signaling.web.dto.IceServersResponse;
import com.avari.signaling.webrtc.IceServerCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * STUN/TURN configuration for browsers, fetched before creating a peer connection.
 */
@RestController
@RequestMapping("/api/ice-servers")
public class IceServerController {

    private final IceServerCatalog iceServerCatalog;

    public IceServerController(IceServerCatalog iceServerCatalog) {
        this.iceServerCatalog = iceServerCatalog;
    }

    @GetMapping
    public ResponseEntity<IceServersResponse> iceServers() {
        return ResponseEntity.ok(new IceServersResponse(iceServerCatalog.iceServers()));
    }
}
