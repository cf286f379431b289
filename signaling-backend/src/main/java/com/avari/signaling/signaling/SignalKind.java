package com.avari.signaling.signaling;

/**
 * WebRTC negotiation messages the router forwards verbatim.
 */
public enum SignalKind {
    OFFER(SignalingEvents.OFFER, "offer", true),
    ANSWER(SignalingEvents.ANSWER, "answer", false),
    ICE_CANDIDATE(SignalingEvents.ICE_CANDIDATE, "candidate", false);

    private final String event;
    private final String payloadField;
    private final boolean reportsOffline;

    SignalKind(String event, String payloadField, boolean reportsOffline) {
        this.event = event;
        this.payloadField = payloadField;
        this.reportsOffline = reportsOffline;
    }

    public String event() {
        return event;
    }

    public String payloadField() {
        return payloadField;
    }

    /**
     * Only the call-opening offer tells the sender its target is gone; answers
     * and candidates for a vanished peer are dropped.
     */
    public boolean reportsOffline() {
        return reportsOffline;
    }
}
