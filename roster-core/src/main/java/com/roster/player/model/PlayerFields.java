package com.roster.player.model;

import java.util.List;
import java.util.Set;

/** Wire names of the fields a reporter submits. */
public final class PlayerFields {
    private PlayerFields() {}

    public static final String PLAYER_NAME = "playerName";
    public static final String DISPLAY_NAME = "displayName";
    public static final String GAME_NAME = "gameName";
    public static final String SERVER_PLAYERS = "serverPlayers";
    public static final String MAX_PLAYERS = "maxPlayers";
    public static final String PLACE_ID = "placeId";
    public static final String JOB_ID = "jobId";
    public static final String CURRENT_TIME = "currentTime";
    public static final String COUNTRY = "country";
    public static final String EXECUTOR = "executor";
    public static final String VERSION = "version";

    public static final String LAST_UPDATED = "lastUpdated";
    public static final String IP = "ip";
    public static final String ORIGIN = "origin";

    /** Keys every submission must carry, in the order they are checked. */
    public static final List<String> REQUIRED = List.of(
            PLAYER_NAME,
            DISPLAY_NAME,
            GAME_NAME,
            SERVER_PLAYERS,
            MAX_PLAYERS,
            PLACE_ID,
            JOB_ID,
            CURRENT_TIME,
            COUNTRY,
            EXECUTOR,
            VERSION);

    public static final List<String> NUMERIC = List.of(SERVER_PLAYERS, MAX_PLAYERS);

    /** Keys owned by the registry; reporter-supplied values for them are never exported. */
    public static final Set<String> RESERVED = Set.of(LAST_UPDATED, IP, ORIGIN);
}
