package com.avari.signaling.signaling;

/**
 * Event names exchanged over the signaling channel.
 */
public final class SignalingEvents {

    // client -> server (offer, answer and ice-candidate travel both ways)
    public static final String REGISTER = "register";
    public static final String INITIATE_CALL = "initiate-call";
    public static final String ACCEPT_CALL = "accept-call";
    public static final String REJECT_CALL = "reject-call";
    public static final String END_CALL = "end-call";
    public static final String OFFER = "offer";
    public static final String ANSWER = "answer";
    public static final String ICE_CANDIDATE = "ice-candidate";
    public static final String TRANSCRIPTION_START = "transcription:start";
    public static final String TRANSCRIPTION_STOP = "transcription:stop";
    public static final String AUDIO_CHUNK = "audio-chunk";

    // server -> client
    public static final String JOINED = "joined";
    public static final String USER_JOINED = "user-joined";
    public static final String USER_LEFT = "user-left";
    public static final String INCOMING_CALL = "incoming-call";
    public static final String CALL_ACCEPTED = "call-accepted";
    public static final String CALL_REJECTED = "call-rejected";
    public static final String CALL_ENDED = "call-ended";
    public static final String ERROR = "error";
    public static final String TRANSCRIPTION_READY = "transcription:ready";
    public static final String TRANSCRIPTION_RESULT = "transcription:result";
    public static final String TRANSCRIPTION_CLOSED = "transcription:closed";
    public static final String TRANSCRIPTION_ERROR = "transcription:error";
    public static final String SERVER_SHUTDOWN = "server-shutdown";

    public static final String TRANSCRIPTION_PREFIX = "transcription:";

    private SignalingEvents() {
    }
}
