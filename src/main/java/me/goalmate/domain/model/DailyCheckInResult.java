package me.goalmate.domain.model;

import java.time.LocalDate;

/**
 * Committed dashboard check-in.
 */
public record DailyCheckInResult(LocalDate date, ExperienceAward award) {
}
