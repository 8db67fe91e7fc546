package com.chatops.faq.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A chat message event delivered to the bot")
public class InboundMessage {

    @Schema(description = "Chat message ID", example = "msg-42")
    private String messageId;

    @Schema(description = "Room the message was posted in", example = "GENERAL")
    private String roomId;

    @Schema(description = "Room type (c = channel, p = private group, d = direct)", example = "c")
    private String roomType;

    @Schema(description = "Display name of the room", example = "general")
    private String roomName;

    private String senderId;
    private String senderUsername;

    @Schema(description = "Sender kind, \"user\" or \"bot\"", example = "user")
    private String senderType;

    @Schema(description = "Message text", example = "How do I create a channel?")
    private String text;

    public boolean isFromBot() {
        return "bot".equalsIgnoreCase(senderType);
    }
}
