package com.ai.storeassistant.dto;

import com.ai.storeassistant.conversation.TurnResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatReply {

    private String sessionId;
    private String response;
    @JsonProperty("continue")
    private boolean continueConversation;
    private String mode;

    public static ChatReply from(TurnResult result) {
        return new ChatReply(result.getSessionId(), result.getResponseText(),
                result.isContinueConversation(), result.getMode().name());
    }
}
