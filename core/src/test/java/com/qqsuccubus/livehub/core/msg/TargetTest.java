package com.qqsuccubus.livehub.core.msg;

import com.qqsuccubus.livehub.core.util.JsonUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TargetTest {

    @Test
    @DisplayName("Empty target admits every user")
    void emptyTargetAdmitsEveryone() {
        Target target = Target.all();

        assertTrue(target.admitsUser("u1"));
        assertTrue(target.admitsUser("u2"));
    }

    @Test
    @DisplayName("Allowlist admits only the listed users")
    void allowlistRestrictsUsers() {
        Target target = Target.users("u1", "u2");

        assertTrue(target.admitsUser("u1"));
        assertTrue(target.admitsUser("u2"));
        assertFalse(target.admitsUser("u3"));
    }

    @Test
    @DisplayName("Exclusion wins over the allowlist")
    void exclusionWinsOverAllowlist() {
        Target target = Target.builder()
            .userIds(List.of("u1", "u2"))
            .excludeUserIds(List.of("u1"))
            .build();

        assertFalse(target.admitsUser("u1"));
        assertTrue(target.admitsUser("u2"));
    }

    @Test
    @DisplayName("Empty allowlist admits nobody")
    void emptyAllowlistAdmitsNobody() {
        Target target = Target.builder().userIds(List.of()).build();

        assertFalse(target.admitsUser("u1"));
    }

    @Test
    @DisplayName("User lists are copied on construction")
    void userListsAreCopied() {
        List<String> users = new ArrayList<>(List.of("u1"));
        Target target = Target.builder().userIds(users).build();

        users.add("u2");

        assertEquals(List.of("u1"), target.getUserIds());
    }

    @Test
    @DisplayName("Absent clauses are omitted from JSON")
    void absentClausesOmittedFromJson() {
        String json = JsonUtils.writeValueAsString(Target.event("e1"));

        assertEquals("{\"eventId\":\"e1\"}", json);
    }

    @Test
    @DisplayName("Target parses from JSON")
    void parsesFromJson() {
        Target target = JsonUtils.readValue(
            "{\"sessionId\":\"s1\",\"excludeUserIds\":[\"u9\"]}", Target.class);

        assertEquals("s1", target.getSessionId());
        assertNull(target.getEventId());
        assertNull(target.getUserIds());
        assertEquals(List.of("u9"), target.getExcludeUserIds());
    }
}
