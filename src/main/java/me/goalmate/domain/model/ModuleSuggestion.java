package me.goalmate.domain.model;

/**
 * A module proposed by the insight provider, not yet attached to a goal.
 */
public record ModuleSuggestion(String name, String description) {
}
