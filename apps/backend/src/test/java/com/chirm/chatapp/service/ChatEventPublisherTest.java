package com.chirm.chatapp.service;

import static com.chirm.chatapp.websocket.hub.TestConnections.drain;
import static com.chirm.chatapp.websocket.hub.TestConnections.drainTypes;
import static com.chirm.chatapp.websocket.hub.TestConnections.registered;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chirm.chatapp.dto.MessageActivity;
import com.chirm.chatapp.websocket.hub.Connection;
import com.chirm.chatapp.websocket.hub.Hub;
import com.chirm.chatapp.websocket.hub.TestConnections;
import com.chirm.chatapp.websocket.hub.VoiceRoomRegistry;
import com.chirm.chatapp.websocket.socketio.broadcast.LocalBroadcastService;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChatEventPublisherTest {

    private Connection viewer;
    private Connection elsewhere;
    private ChatEventPublisher publisher;

    @BeforeEach
    void setUp() {
        Hub hub = TestConnections.newHub(new VoiceRoomRegistry());
        publisher = new ChatEventPublisher(new LocalBroadcastService(hub));
        viewer = registered(hub, "c1", "u1");
        elsewhere = registered(hub, "c2", "u2");
        viewer.setViewedChannelId("general");
        elsewhere.setViewedChannelId("random");
    }

    @Test
    void newMessageGoesToViewersAndActivityToEveryone() {
        MessageActivity activity = MessageActivity.of("general", "general", "u9", "nova", "hello there", "m1");

        publisher.messageCreated("general", Map.of("id", "m1", "content", "hello there"), activity);

        assertThat(drainTypes(viewer)).containsExactly("message.new", "message.activity");
        List<JsonNode> frames = drain(elsewhere);
        assertThat(frames).hasSize(1);
        JsonNode data = frames.get(0).path("data");
        assertThat(frames.get(0).path("type").asText()).isEqualTo("message.activity");
        assertThat(data.path("channel_id").asText()).isEqualTo("general");
        assertThat(data.path("channel_name").asText()).isEqualTo("general");
        assertThat(data.path("author_id").asText()).isEqualTo("u9");
        assertThat(data.path("author").asText()).isEqualTo("nova");
        assertThat(data.path("preview").asText()).isEqualTo("hello there");
        assertThat(data.path("message_id").asText()).isEqualTo("m1");
    }

    @Test
    void messageWithoutActivityIsRejectedBeforeAnyDelivery() {
        assertThatThrownBy(() -> publisher.messageCreated("general", Map.of("id", "m1"), null))
                .isInstanceOf(NullPointerException.class);

        assertThat(drainTypes(viewer)).isEmpty();
        assertThat(drainTypes(elsewhere)).isEmpty();
    }

    @Test
    void channelScopedEventsStayInChannel() {
        publisher.messageEdited("general", Map.of("id", "m1"));
        publisher.messageDeleted("general", "m1");
        publisher.reactionUpdated("general", List.of(Map.of("emoji", "+1", "count", 2)));

        List<JsonNode> frames = drain(viewer);
        assertThat(frames).extracting(frame -> frame.path("type").asText())
                .containsExactly("message.edit", "message.delete", "reaction.update");
        JsonNode deleted = frames.get(1).path("data");
        assertThat(deleted.path("id").asText()).isEqualTo("m1");
        assertThat(deleted.path("channel_id").asText()).isEqualTo("general");
        assertThat(drainTypes(elsewhere)).isEmpty();
    }

    @Test
    void serverStructureEventsGoToEveryone() {
        publisher.channelCreated(Map.of("id", "ch1"));
        publisher.channelUpdated(Map.of("id", "ch1"));
        publisher.channelDeleted("ch1");
        publisher.channelsReordered(List.of());
        publisher.categoryCreated(Map.of("id", "cat1"));
        publisher.categoriesUpdated(List.of());
        publisher.categoryDeleted("cat1", List.of(Map.of("id", "ch1")));
        publisher.memberJoined(Map.of("id", "u3"));
        publisher.emojiCreated(Map.of("id", "e1"));
        publisher.emojiDeleted("e1");

        List<String> expected = List.of(
                "channel.new", "channel.update", "channel.delete", "channels.reorder",
                "category.new", "categories.update", "category.delete",
                "member.new", "emoji.new", "emoji.delete");
        List<JsonNode> frames = drain(viewer);
        assertThat(frames).extracting(frame -> frame.path("type").asText()).containsExactlyElementsOf(expected);
        assertThat(drainTypes(elsewhere)).containsExactlyElementsOf(expected);

        assertThat(frames.get(2).path("data").path("id").asText()).isEqualTo("ch1");
        assertThat(frames.get(6).path("data").path("channels").get(0).path("id").asText()).isEqualTo("ch1");
        assertThat(frames.get(9).path("data").path("id").asText()).isEqualTo("e1");
    }
}
