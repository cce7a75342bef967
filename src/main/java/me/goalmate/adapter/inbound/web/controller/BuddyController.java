package me.goalmate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.goalmate.domain.service.InsightService;
import me.goalmate.infrastructure.config.GoalMateProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Accountability buddy chat. Replies come from the insight provider.
 */
@RestController
@RequestMapping("/api/buddy")
@RequiredArgsConstructor
public class BuddyController {

    private final InsightService insightService;
    private final GoalMateProperties properties;

    @GetMapping
    public Mono<ResponseEntity<BuddyResponse>> getBuddy() {
        return Mono.just(ResponseEntity.ok(new BuddyResponse(properties.getBuddy().getName())));
    }

    @PostMapping("/messages")
    public Mono<ResponseEntity<ReplyResponse>> sendMessage(@RequestBody MessageRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required");
        }
        String buddyName = properties.getBuddy().getName();
        return Mono.fromFuture(insightService.chatReply(buddyName, request.message().trim()))
                .map(reply -> ResponseEntity.ok(new ReplyResponse(buddyName, reply)));
    }

    record MessageRequest(String message) {
    }

    record BuddyResponse(String name) {
    }

    record ReplyResponse(String from, String text) {
    }
}
