package me.goalmate.domain.model;

/**
 * Display-ready progress of a goal.
 */
public record GoalProgress(int percent, String text) {
}
