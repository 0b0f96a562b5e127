package com.example.messaging.shared.dto;

import com.example.messaging.shared.util.Constants.LayoutMode;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import lombok.With;

/**
 * Transient list/detail presentation state. Rebuilt at every session start.
 */
@Value
@With
public class ViewState {
    String selectedConversationId;
    LayoutMode layoutMode;

    public static ViewState initial() {
        return new ViewState(null, LayoutMode.DESKTOP);
    }

    @JsonProperty("listVisible")
    public boolean isListVisible() {
        return layoutMode != LayoutMode.MOBILE_CHAT;
    }

    @JsonProperty("chatVisible")
    public boolean isChatVisible() {
        return layoutMode == LayoutMode.DESKTOP || layoutMode == LayoutMode.MOBILE_CHAT;
    }
}
