package me.goalmate.domain.model;

/**
 * A short weekly task suggestion tied to one of the user's goals.
 * {@code relatedGoal} is a goal title, {@code "General"}, or empty.
 */
public record Quest(String title, String description, String relatedGoal) {
}
