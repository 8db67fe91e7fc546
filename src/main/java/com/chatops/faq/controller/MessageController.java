package com.chatops.faq.controller;

import com.chatops.faq.model.InboundMessage;
import com.chatops.faq.model.ProcessingResult;
import com.chatops.faq.service.FaqMessageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/messages")
@Tag(name = "Messages", description = "Inbound chat message events")
public class MessageController {

    private final FaqMessageService messageService;

    public MessageController(FaqMessageService messageService) {
        this.messageService = messageService;
    }

    @PostMapping
    @Operation(summary = "Process a chat message",
               description = "Classifies the message and answers it directly, escalates it to a reviewer, "
                       + "or drops it. Returns what was done.")
    public ResponseEntity<ProcessingResult> processMessage(@RequestBody InboundMessage message) {
        if (message.getMessageId() == null || message.getMessageId().isBlank()) {
            throw new IllegalArgumentException("messageId is required");
        }
        if (message.getRoomId() == null || message.getRoomId().isBlank()) {
            throw new IllegalArgumentException("roomId is required");
        }
        return ResponseEntity.ok(messageService.process(message));
    }
}
