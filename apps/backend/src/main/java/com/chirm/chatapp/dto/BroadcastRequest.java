package com.chirm.chatapp.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 외부 프로세스 producer 의 브로드캐스트 요청.
 *
 * GLOBAL 이외의 scope 는 target 이 필요하다.
 */
public record BroadcastRequest(
        @NotNull BroadcastScope scope,
        String target,
        @NotBlank String type,
        JsonNode data
) {

    @AssertTrue(message = "target is required for this scope")
    public boolean isTargetPresent() {
        return scope == null || scope == BroadcastScope.GLOBAL || (target != null && !target.isBlank());
    }

    public enum BroadcastScope {
        GLOBAL,
        CHANNEL,
        USER,
        ROOM
    }
}
