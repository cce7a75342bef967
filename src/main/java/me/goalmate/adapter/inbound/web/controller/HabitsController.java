package me.goalmate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.goalmate.domain.model.CheckIn;
import me.goalmate.domain.model.Goal;
import me.goalmate.domain.model.Habit;
import me.goalmate.domain.model.Proof;
import me.goalmate.domain.service.HabitService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

/**
 * Habit trackers: check-ins with proof and streak freezes.
 */
@RestController
@RequestMapping("/api/habits")
@RequiredArgsConstructor
public class HabitsController {

    private final HabitService habitService;

    @GetMapping
    public Mono<ResponseEntity<List<HabitDto>>> getHabits() {
        List<HabitDto> habits = habitService.getHabits().stream()
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(habits));
    }

    @GetMapping("/{habitId}")
    public Mono<ResponseEntity<HabitDto>> getHabit(@PathVariable String habitId) {
        return Mono.just(habitService.getHabit(habitId)
                .map(habit -> ResponseEntity.ok(toDto(habit)))
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @PostMapping
    public Mono<ResponseEntity<HabitDto>> createHabit(@RequestBody CreateHabitRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        Habit habit = habitService.createHabit(request.name(), request.description());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(habit)));
    }

    @PostMapping("/{habitId}/check-ins")
    public Mono<ResponseEntity<HabitDto>> checkIn(@PathVariable String habitId,
            @RequestBody CheckInRequest request) {
        if (request == null || request.kind() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Proof kind is required");
        }
        Proof proof = Proof.builder()
                .kind(request.kind())
                .value(request.value())
                .comment(request.comment())
                .build();
        habitService.checkIn(habitId, proof);
        return Mono.just(ResponseEntity.ok(toDto(requireHabit(habitId))));
    }

    @PostMapping("/{habitId}/freeze")
    public Mono<ResponseEntity<HabitDto>> useStreakFreeze(@PathVariable String habitId) {
        habitService.useStreakFreeze(habitId);
        return Mono.just(ResponseEntity.ok(toDto(requireHabit(habitId))));
    }

    private Habit requireHabit(String habitId) {
        return habitService.getHabit(habitId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Habit not found: " + habitId));
    }

    private HabitDto toDto(Habit habit) {
        List<LogDto> logs = habit.getLogs().stream()
                .map(HabitsController::toLogDto)
                .toList();
        String linkedGoal = habitService.findLinkedGoal(habit.getId())
                .map(Goal::getTitle)
                .orElse(null);
        Habit.StreakFreezes freezes = habit.getStreakFreezes();
        return new HabitDto(habit.getId(), habit.getName(), habit.getDescription(), habit.getCurrentStreak(),
                habit.getLongestStreak(), freezes.getRemaining(), freezes.getTotal(),
                habitService.isCheckedInToday(habit.getId()), linkedGoal, logs);
    }

    private static LogDto toLogDto(CheckIn checkIn) {
        Proof proof = checkIn.getProof();
        return new LogDto(checkIn.getDate(), checkIn.getStatus().name(),
                proof != null ? proof.getKind().name() : null,
                proof != null ? proof.getValue() : null,
                proof != null ? proof.getComment() : null);
    }

    record CreateHabitRequest(String name, String description) {
    }

    record CheckInRequest(Proof.ProofKind kind, String value, String comment) {
    }

    record HabitDto(String id, String name, String description, int currentStreak, int longestStreak,
            int freezesRemaining, int freezesTotal, boolean checkedInToday, String linkedGoal, List<LogDto> logs) {
    }

    record LogDto(LocalDate date, String status, String proofKind, String proofValue, String comment) {
    }
}
