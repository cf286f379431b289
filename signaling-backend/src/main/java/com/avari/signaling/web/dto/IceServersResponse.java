package com.avari.signaling.web.dto;

import com.avari.signaling.webrtc.IceServer;

import java.util.List;

public record IceServersResponse(List<IceServer> iceServers) {
}
