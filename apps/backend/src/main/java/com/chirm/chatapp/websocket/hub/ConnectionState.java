package com.chirm.chatapp.websocket.hub;

public enum ConnectionState {
    CONNECTING,
    ACTIVE,
    CLOSING,
    CLOSED
}
