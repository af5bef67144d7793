package com.qqsuccubus.livehub.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Selection criteria for a broadcast. All present clauses are AND-combined.
 * <p>
 * <ul>
 *   <li>{@code eventId}, {@code sessionId}: connection must match when present</li>
 *   <li>{@code userIds}: allowlist; when present only these users are eligible</li>
 *   <li>{@code excludeUserIds}: applied after the allowlist and always wins</li>
 * </ul>
 * A target with no clauses selects every alive connection.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Target {
    private static final Target ALL = new Target(null, null, null, null);

    @JsonProperty("eventId")
    String eventId;

    @JsonProperty("sessionId")
    String sessionId;

    @JsonProperty("userIds")
    List<String> userIds;

    @JsonProperty("excludeUserIds")
    List<String> excludeUserIds;

    @JsonCreator
    public Target(
        @JsonProperty("eventId") String eventId,
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("userIds") List<String> userIds,
        @JsonProperty("excludeUserIds") List<String> excludeUserIds
    ) {
        this.eventId = eventId;
        this.sessionId = sessionId;
        this.userIds = userIds == null ? null : List.copyOf(userIds);
        this.excludeUserIds = excludeUserIds == null ? null : List.copyOf(excludeUserIds);
    }

    public static Target all() {
        return ALL;
    }

    public static Target event(String eventId) {
        return Target.builder().eventId(eventId).build();
    }

    public static Target session(String sessionId) {
        return Target.builder().sessionId(sessionId).build();
    }

    public static Target users(String... userIds) {
        return Target.builder().userIds(List.of(userIds)).build();
    }

    /**
     * @return true if the given user passes the allowlist and exclusion clauses
     */
    public boolean admitsUser(String userId) {
        if (userIds != null && !userIds.contains(userId)) {
            return false;
        }
        return excludeUserIds == null || !excludeUserIds.contains(userId);
    }
}
