package com.chirm.chatapp.websocket.protocol;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class InboundFrameDecoderTest {

    private final InboundFrameDecoder decoder = new InboundFrameDecoder(new ObjectMapper());

    @Test
    void decodesVoiceJoin() {
        Optional<DecodedCommand> decoded = decoder.decode(
                "{\"type\":\"voice.join\",\"data\":{\"channel_id\":\"general-voice\"}}");

        assertThat(decoded).isPresent();
        assertThat(decoded.get().type()).isEqualTo(InboundCommandType.VOICE_JOIN);
        assertThat(decoded.get().commandAs(ChannelCommand.class).channelId()).isEqualTo("general-voice");
    }

    @Test
    void keepsSignalPayloadUntouched() {
        Optional<DecodedCommand> decoded = decoder.decode(
                "{\"type\":\"voice.ice\",\"data\":{\"channel_id\":\"v\",\"target_user_id\":\"u2\","
                        + "\"payload\":{\"candidate\":\"c\",\"sdpMLineIndex\":0}}}");

        assertThat(decoded).isPresent();
        SignalCommand signal = decoded.get().commandAs(SignalCommand.class);
        assertThat(signal.targetUserId()).isEqualTo("u2");
        assertThat(signal.payload().path("candidate").asText()).isEqualTo("c");
        assertThat(signal.payload().path("sdpMLineIndex").asInt()).isZero();
    }

    @Test
    void decodesMediaState() {
        Optional<DecodedCommand> decoded = decoder.decode(
                "{\"type\":\"voice.media_state\",\"data\":{\"channel_id\":\"v\",\"cam_enabled\":true}}");

        MediaStateCommand command = decoded.orElseThrow().commandAs(MediaStateCommand.class);
        assertThat(command.camEnabled()).isTrue();
        assertThat(command.screenSharing()).isFalse();
    }

    @Test
    void subscribeWithoutChannelIsAccepted() {
        Optional<DecodedCommand> decoded = decoder.decode("{\"type\":\"subscribe\",\"data\":{}}");

        assertThat(decoded).isPresent();
        assertThat(decoded.get().commandAs(SubscribeCommand.class).channelId()).isNull();
    }

    @Test
    void ignoresUnknownFieldsInData() {
        Optional<DecodedCommand> decoded = decoder.decode(
                "{\"type\":\"typing\",\"data\":{\"channel_id\":\"general\",\"extra\":1}}");

        assertThat(decoded).isPresent();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "   ",
            "not json",
            "{\"type\":",
            "[1,2,3]",
            "\"voice.join\"",
            "{\"type\":\"voice.teleport\",\"data\":{}}",
            "{\"data\":{\"channel_id\":\"v\"}}",
            "{\"type\":\"voice.join\"}",
            "{\"type\":\"voice.join\",\"data\":\"general\"}",
            "{\"type\":\"voice.join\",\"data\":{}}",
            "{\"type\":\"voice.join\",\"data\":{\"channel_id\":\"\"}}",
            "{\"type\":\"voice.offer\",\"data\":{\"channel_id\":\"v\"}}",
            "{\"type\":\"typing\",\"data\":{}}",
            "{\"type\":\"voice.media_state\",\"data\":{\"cam_enabled\":true}}",
            "{\"type\":\"voice.media_state\",\"data\":{\"channel_id\":\"v\",\"cam_enabled\":\"maybe\"}}"
    })
    void discardsMalformedFrames(String frame) {
        assertThat(decoder.decode(frame)).isEmpty();
    }
}
