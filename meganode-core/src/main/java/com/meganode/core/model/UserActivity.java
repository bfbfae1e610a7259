package com.meganode.core.model;

/**
 * Liveness signal for a user. Fire-and-forget.
 */
public record UserActivity(UserPk userPk) implements RunnerCommand {
}
