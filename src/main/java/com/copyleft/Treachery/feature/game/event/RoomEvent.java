package com.copyleft.Treachery.feature.game.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 방 상태 변화 알림. 전송 계층이 구독해서 클라이언트에 전달한다.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class RoomEvent {
    private final String roomCode;
    private final Type type;
    private final String playerId;   // 입장/퇴장 이벤트만
    private final int countdown;     // COUNTDOWN_UPDATE 만

    public enum Type {
        PLAYER_JOINED,    // 플레이어 입장
        PLAYER_LEFT,      // 플레이어 퇴장
        GAME_STARTED,     // 역할 배정 완료 -> 카운트다운 시작
        COUNTDOWN_UPDATE, // 카운트다운 1초 경과
        GAME_PLAYING,     // 카운트다운 종료, 리더 공개
        GAME_ENDED        // 게임 종료
    }

    public static RoomEvent of(String roomCode, Type type) {
        return new RoomEvent(roomCode, type, null, 0);
    }

    public static RoomEvent player(String roomCode, Type type, String playerId) {
        return new RoomEvent(roomCode, type, playerId, 0);
    }

    public static RoomEvent countdown(String roomCode, int remaining) {
        return new RoomEvent(roomCode, Type.COUNTDOWN_UPDATE, null, remaining);
    }
}
