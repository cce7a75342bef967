package me.goalmate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.goalmate.domain.model.ExperienceAward;
import me.goalmate.domain.model.Goal;
import me.goalmate.domain.model.GoalModule;
import me.goalmate.domain.model.GoalProgress;
import me.goalmate.domain.model.Habit;
import me.goalmate.domain.service.GoalService;
import me.goalmate.domain.service.ModuleSuggestionService;
import me.goalmate.domain.service.ProgressProjector;
import me.goalmate.infrastructure.config.GoalMateProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Goals, their modules and habit links. Every response carries freshly
 * projected progress.
 */
@RestController
@RequestMapping("/api/goals")
@RequiredArgsConstructor
public class GoalsController {

    private final GoalService goalService;
    private final ModuleSuggestionService moduleSuggestionService;
    private final ProgressProjector progressProjector;
    private final GoalMateProperties properties;

    @GetMapping
    public Mono<ResponseEntity<List<GoalDto>>> getGoals() {
        List<GoalDto> goals = goalService.getGoals().stream()
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(goals));
    }

    @GetMapping("/{goalId}")
    public Mono<ResponseEntity<GoalDto>> getGoal(@PathVariable String goalId) {
        return Mono.just(goalService.getGoal(goalId)
                .map(goal -> ResponseEntity.ok(toDto(goal)))
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @PostMapping
    public Mono<ResponseEntity<GoalDto>> createGoal(@RequestBody CreateGoalRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        Goal goal = goalService.createGoal(request.title(), request.category(), request.description(),
                request.kind(), request.modules());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(goal)));
    }

    @PostMapping("/{goalId}/modules")
    public Mono<ResponseEntity<GoalDto>> addModule(@PathVariable String goalId,
            @RequestBody AddModuleRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        goalService.addModule(goalId, request.name(), request.description(), GoalModule.ModuleSource.USER);
        return Mono.just(ResponseEntity.ok(toDto(requireGoal(goalId))));
    }

    @PostMapping("/{goalId}/modules/generate")
    public Mono<ResponseEntity<GoalDto>> generateModules(@PathVariable String goalId) {
        Goal goal = requireGoal(goalId);
        if (!goal.isLearning()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Only learning goals have modules");
        }
        return Mono.fromFuture(moduleSuggestionService.suggestModules(goal.getTitle(), goal.getDescription()))
                .map(suggestions -> {
                    goalService.addGeneratedModules(goalId, suggestions);
                    return ResponseEntity.ok(toDto(requireGoal(goalId)));
                });
    }

    @PostMapping("/{goalId}/modules/{moduleId}/self-complete")
    public Mono<ResponseEntity<ModuleActionResponse>> selfCompleteModule(@PathVariable String goalId,
            @PathVariable String moduleId) {
        ExperienceAward award = goalService.selfCompleteModule(goalId, moduleId,
                properties.getRewards().getModuleSelfCompletion());
        return Mono.just(ResponseEntity.ok(new ModuleActionResponse(toDto(requireGoal(goalId)), award.amount())));
    }

    @PutMapping("/{goalId}/progress")
    public Mono<ResponseEntity<GoalDto>> updateProgress(@PathVariable String goalId,
            @RequestBody UpdateProgressRequest request) {
        if (request == null || request.percent() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "percent is required");
        }
        Goal goal = goalService.updateGenericProgress(goalId, request.percent(), request.statusText());
        return Mono.just(ResponseEntity.ok(toDto(goal)));
    }

    @PostMapping("/{goalId}/finalize")
    public Mono<ResponseEntity<GoalDto>> finalizeGoal(@PathVariable String goalId) {
        return Mono.just(ResponseEntity.ok(toDto(goalService.finalizeGoal(goalId))));
    }

    @PostMapping("/{goalId}/habit")
    public Mono<ResponseEntity<GoalDto>> linkHabit(@PathVariable String goalId,
            @RequestBody LinkHabitRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        if (request.habitId() != null && !request.habitId().isBlank()) {
            goalService.linkHabit(goalId, request.habitId());
        } else if (request.habitName() != null && !request.habitName().isBlank()) {
            goalService.createAndLinkHabit(goalId, request.habitName());
        } else {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "habitId or habitName is required");
        }
        return Mono.just(ResponseEntity.ok(toDto(requireGoal(goalId))));
    }

    @GetMapping("/{goalId}/habit")
    public Mono<ResponseEntity<LinkedHabitDto>> getLinkedHabit(@PathVariable String goalId) {
        return Mono.just(goalService.getLinkedHabit(goalId)
                .map(habit -> ResponseEntity.ok(toLinkedHabitDto(habit)))
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    private Goal requireGoal(String goalId) {
        return goalService.getGoal(goalId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Goal not found: " + goalId));
    }

    private GoalDto toDto(Goal goal) {
        GoalProgress progress = progressProjector.project(goal);
        List<ModuleDto> modules = goal.getModules().stream()
                .map(m -> new ModuleDto(m.getId(), m.getName(), m.getDescription(), m.getStatus().name(),
                        m.isVerified(), m.getSource().name()))
                .toList();
        return new GoalDto(goal.getId(), goal.getTitle(), goal.getCategory(), goal.getDescription(),
                goal.getKind().name(), progress.percent(), progress.text(), goal.isFinalized(),
                goal.getLinkedHabitId(), modules);
    }

    private static LinkedHabitDto toLinkedHabitDto(Habit habit) {
        return new LinkedHabitDto(habit.getId(), habit.getName(), habit.getCurrentStreak(),
                habit.getLongestStreak());
    }

    record CreateGoalRequest(String title, String category, String description, Goal.GoalKind kind,
            List<String> modules) {
    }

    record AddModuleRequest(String name, String description) {
    }

    record UpdateProgressRequest(Integer percent, String statusText) {
    }

    record LinkHabitRequest(String habitId, String habitName) {
    }

    record GoalDto(String id, String title, String category, String description, String kind,
            int progressPercent, String progressText, boolean finalized, String linkedHabitId,
            List<ModuleDto> modules) {
    }

    record ModuleDto(String id, String name, String description, String status, boolean verified,
            String source) {
    }

    record ModuleActionResponse(GoalDto goal, long xpAwarded) {
    }

    record LinkedHabitDto(String id, String name, int currentStreak, int longestStreak) {
    }
}
