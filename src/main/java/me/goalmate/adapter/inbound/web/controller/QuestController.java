package me.goalmate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.goalmate.domain.model.Quest;
import me.goalmate.domain.service.WeeklyQuestService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Weekly quest for the dashboard.
 */
@RestController
@RequestMapping("/api/quests")
@RequiredArgsConstructor
public class QuestController {

    private final WeeklyQuestService weeklyQuestService;

    @GetMapping("/weekly")
    public Mono<ResponseEntity<Quest>> getWeeklyQuest() {
        return Mono.fromFuture(weeklyQuestService.fetchWeeklyQuest())
                .map(ResponseEntity::ok);
    }
}
