package me.goalmate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.goalmate.domain.model.CheckInCountEntry;
import me.goalmate.domain.model.DailyCheckInResult;
import me.goalmate.domain.model.LevelProgress;
import me.goalmate.domain.model.Perk;
import me.goalmate.domain.model.UserProfile;
import me.goalmate.domain.model.XpLogEntry;
import me.goalmate.domain.service.ActivityLogService;
import me.goalmate.domain.service.DailyCheckInService;
import me.goalmate.domain.service.LevelingService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Profile, level, perks and the daily dashboard check-in.
 */
@RestController
@RequestMapping("/api/profile")
@RequiredArgsConstructor
public class ProfileController {

    private final LevelingService levelingService;
    private final ActivityLogService activityLogService;
    private final DailyCheckInService dailyCheckInService;

    @GetMapping
    public Mono<ResponseEntity<ProfileResponse>> getProfile() {
        return Mono.just(ResponseEntity.ok(buildProfile()));
    }

    @GetMapping("/activity")
    public Mono<ResponseEntity<ActivityResponse>> getActivity() {
        return Mono.just(ResponseEntity.ok(new ActivityResponse(
                activityLogService.getXpLog(),
                activityLogService.getCheckInLog())));
    }

    @PutMapping("/dark-mode")
    public Mono<ResponseEntity<ProfileResponse>> setDarkMode(@RequestBody DarkModeRequest request) {
        if (request == null || request.enabled() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "enabled is required");
        }
        levelingService.setDarkMode(request.enabled());
        return Mono.just(ResponseEntity.ok(buildProfile()));
    }

    @GetMapping("/check-in")
    public Mono<ResponseEntity<CheckInStatusResponse>> getCheckInStatus() {
        return Mono.just(ResponseEntity.ok(new CheckInStatusResponse(dailyCheckInService.isCheckedInToday())));
    }

    @PostMapping("/check-in")
    public Mono<ResponseEntity<CheckInResponse>> checkIn() {
        return Mono.fromFuture(dailyCheckInService.checkIn())
                .map(result -> ResponseEntity.ok(toCheckInResponse(result)));
    }

    private ProfileResponse buildProfile() {
        UserProfile profile = levelingService.getProfile();
        LevelProgress progress = levelingService.getLevelProgress();
        List<PerkDto> perks = Arrays.stream(Perk.values())
                .map(perk -> new PerkDto(perk.name(), perk.getDisplayName(), perk.getXpRequired(),
                        profile.hasPerk(perk)))
                .toList();
        return new ProfileResponse(profile.getExperience(), profile.getLevel(), progress.currentLevelXp(),
                progress.nextLevelXp(), progress.percent(), profile.isDarkModeEnabled(), perks);
    }

    private static CheckInResponse toCheckInResponse(DailyCheckInResult result) {
        return new CheckInResponse(result.date(), result.award().amount(), result.award().experience(),
                result.award().level(), result.award().leveledUp());
    }

    record DarkModeRequest(Boolean enabled) {
    }

    record ProfileResponse(long experience, int level, long currentLevelXp, long nextLevelXp,
            double levelPercent, boolean darkModeEnabled, List<PerkDto> perks) {
    }

    record PerkDto(String id, String name, long xpRequired, boolean unlocked) {
    }

    record ActivityResponse(List<XpLogEntry> xpLog, List<CheckInCountEntry> checkInLog) {
    }

    record CheckInStatusResponse(boolean checkedInToday) {
    }

    record CheckInResponse(LocalDate date, long xpAwarded, long experience, int level, boolean leveledUp) {
    }
}
