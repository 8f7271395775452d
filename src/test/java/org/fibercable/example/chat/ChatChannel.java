package org.fibercable.example.chat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.fibercable.channel.Actions;
import org.fibercable.channel.Channel;
import org.fibercable.core.Json;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Joins {@code room_<room>} when a room param is given and relays what members say.
 */
public class ChatChannel extends Channel {

    private static final Actions<ChatChannel> ACTIONS = Actions.builder(ChatChannel.class)
            .action("speak", ChatChannel::speak)
            .trigger("away", ChatChannel::away)
            .action("follow", ChatChannel::follow)
            .trigger("unfollow", ChatChannel::unfollow)
            .trigger("explode", ChatChannel::explode)
            .build();

    public final List<ObjectNode> spoken = new CopyOnWriteArrayList<>();
    public final AtomicInteger awayCount = new AtomicInteger();
    public final AtomicInteger subscribedCount = new AtomicInteger();
    public final AtomicInteger unsubscribedCount = new AtomicInteger();

    @Override
    protected void subscribed() {
        subscribedCount.incrementAndGet();
        if (getParams().path("reject").asBoolean(false)) {
            rejectSubscription();
        }
        String room = getParams().path("room").asText(null);
        if (room != null) {
            streamFrom("room_" + room);
        }
    }

    @Override
    protected void unsubscribed() {
        unsubscribedCount.incrementAndGet();
    }

    @Override
    protected Actions<ChatChannel> actions() {
        return ACTIONS;
    }

    private void speak(ObjectNode data) {
        spoken.add(data);
        String room = getParams().path("room").asText(null);
        if (room != null) {
            ObjectNode msg = Json.object();
            msg.put("content", data.path("content").asText());
            msg.set("from", Json.mapper().valueToTree(identity("current_user")));
            getConnection().getServer().broadcast("room_" + room, msg);
        }
    }

    private void away() {
        awayCount.incrementAndGet();
    }

    private void follow(ObjectNode data) {
        streamFrom("comments_for_" + data.path("recording_id").asText());
    }

    private void unfollow() {
        stopAllStreams();
    }

    private void explode() {
        throw new IllegalStateException("boom");
    }
}
