package com.roster.player.model;

import java.util.Map;
import java.util.Objects;

/**
 * Identity of a tracked record: the reporter's handle plus the game server job it is connected to.
 */
public record PlayerKey(String playerName, String jobId) {

    public PlayerKey {
        Objects.requireNonNull(playerName, "playerName");
        Objects.requireNonNull(jobId, "jobId");
    }

    /** Builds the key from submitted fields; non-string values use their string form. */
    public static PlayerKey from(Map<String, ?> fields) {
        return new PlayerKey(
                String.valueOf(fields.get(PlayerFields.PLAYER_NAME)), String.valueOf(fields.get(PlayerFields.JOB_ID)));
    }

    @Override
    public String toString() {
        return playerName + "-" + jobId;
    }
}
