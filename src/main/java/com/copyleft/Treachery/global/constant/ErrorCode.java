package com.copyleft.Treachery.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {

    INVALID_NAME("player name must not be blank"),
    DUPLICATE_NAME("a player with that name already exists in the room"),

    ROOM_NOT_FOUND("room not found"),
    ROOM_FULL("room is full"),
    GAME_ALREADY_STARTED("game has already started"),
    GAME_START_FAILED("failed to start the game, please try again"),
    ROOM_BUSY("room is busy, please try again"),

    PRESET_NOT_FOUND("preset not found"),
    TOO_MANY_ROLES("too many roles for player count"),
    INVALID_ROLE_CONFIG("invalid role configuration"),
    UNKNOWN_ROLE_TYPE("unknown role type"),

    UNKNOWN_ERROR("unknown error");

    private final String message;
}
