package com.qqsuccubus.livehub.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Message pushed to WebSocket clients.
 * <p>
 * Wire shape:
 * <pre>
 * { "id": "...", "type": "event_update", "data": {...},
 *   "timestamp": "2024-01-01T00:00:00Z", "target": {...} }
 * </pre>
 * </p>
 * <p>
 * Instances are immutable. {@link #withDefaults()} fills in a missing id and timestamp,
 * which is done once when the message is queued or sent.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BroadcastMessage {
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    @JsonProperty("id")
    String id;

    @JsonProperty("type")
    MessageType type;

    /**
     * Application payload, any Jackson-serializable value.
     */
    @JsonProperty("data")
    Object data;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("target")
    Target target;

    @JsonCreator
    public BroadcastMessage(
        @JsonProperty("id") String id,
        @JsonProperty("type") MessageType type,
        @JsonProperty("data") Object data,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("target") Target target
    ) {
        this.id = id;
        this.type = type;
        this.data = data;
        this.timestamp = timestamp;
        this.target = target;
    }

    public static BroadcastMessage of(MessageType type, Object data) {
        return BroadcastMessage.builder().type(type).data(data).build().withDefaults();
    }

    public static BroadcastMessage of(MessageType type, Object data, Target target) {
        return BroadcastMessage.builder().type(type).data(data).target(target).build().withDefaults();
    }

    /**
     * Returns this message with a generated id and the current time filled in where absent.
     */
    public BroadcastMessage withDefaults() {
        if (id != null && timestamp != null) {
            return this;
        }
        return toBuilder()
            .id(id != null ? id : generateId("msg"))
            .timestamp(timestamp != null ? timestamp : Instant.now())
            .build();
    }

    /**
     * Generates ids of the form {@code <prefix>_<epochMillis>_<9 random base36 chars>}.
     */
    public static String generateId(String prefix) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(prefix.length() + 24)
            .append(prefix).append('_').append(System.currentTimeMillis()).append('_');
        for (int i = 0; i < 9; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }
}
