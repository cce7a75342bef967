package me.goalmate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.goalmate.domain.model.GoalProgress;
import me.goalmate.domain.model.VerificationChallenge;
import me.goalmate.domain.model.VerificationOutcome;
import me.goalmate.domain.service.ModuleVerificationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Module verification dialog: open, answer, self-complete or cancel.
 */
@RestController
@RequestMapping("/api/verifications")
@RequiredArgsConstructor
public class VerificationController {

    private final ModuleVerificationService verificationService;

    @PostMapping
    public Mono<ResponseEntity<ChallengeResponse>> start(@RequestBody StartRequest request) {
        if (request == null || request.goalId() == null || request.moduleId() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "goalId and moduleId are required");
        }
        return Mono.fromFuture(verificationService.start(request.goalId(), request.moduleId()))
                .map(challenge -> ResponseEntity.ok(toResponse(challenge)));
    }

    @PostMapping("/{ticket}/answer")
    public Mono<ResponseEntity<OutcomeResponse>> submitAnswer(@PathVariable String ticket,
            @RequestBody AnswerRequest request) {
        String answer = request != null ? request.answer() : null;
        return Mono.fromFuture(verificationService.submitAnswer(ticket, answer))
                .map(outcome -> ResponseEntity.ok(toResponse(outcome)));
    }

    @PostMapping("/{ticket}/self-complete")
    public Mono<ResponseEntity<OutcomeResponse>> selfComplete(@PathVariable String ticket) {
        return Mono.just(ResponseEntity.ok(toResponse(verificationService.selfComplete(ticket))));
    }

    @DeleteMapping("/{ticket}")
    public Mono<ResponseEntity<Void>> cancel(@PathVariable String ticket) {
        verificationService.cancel(ticket);
        return Mono.just(ResponseEntity.noContent().build());
    }

    private static ChallengeResponse toResponse(VerificationChallenge challenge) {
        return new ChallengeResponse(challenge.ticket(), challenge.goalId(), challenge.moduleId(),
                challenge.moduleName(), challenge.question());
    }

    private static OutcomeResponse toResponse(VerificationOutcome outcome) {
        GoalProgress progress = outcome.progress();
        return new OutcomeResponse(outcome.applied(), outcome.feedback(),
                progress != null ? progress.percent() : null,
                progress != null ? progress.text() : null,
                outcome.award() != null ? outcome.award().amount() : 0);
    }

    record StartRequest(String goalId, String moduleId) {
    }

    record AnswerRequest(String answer) {
    }

    record ChallengeResponse(String ticket, String goalId, String moduleId, String moduleName, String question) {
    }

    record OutcomeResponse(boolean applied, String feedback, Integer progressPercent, String progressText,
            long xpAwarded) {
    }
}
