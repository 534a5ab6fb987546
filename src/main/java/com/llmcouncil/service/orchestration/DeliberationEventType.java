package com.llmcouncil.service.orchestration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stage-boundary checkpoints of a turn, in the order they can occur.
 */
public enum DeliberationEventType {
    STAGE1_START("stage1_start"),
    STAGE1_COMPLETE("stage1_complete"),
    STAGE2_START("stage2_start"),
    STAGE2_COMPLETE("stage2_complete"),
    STAGE3_START("stage3_start"),
    STAGE3_COMPLETE("stage3_complete"),
    TITLE_COMPLETE("title_complete"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    DeliberationEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
