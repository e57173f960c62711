package com.copyleft.Treachery.domain;

import com.copyleft.Treachery.global.util.RandomUtil;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 방 참가자. 방은 이 객체 자체를 공유하므로 역할 배정 결과가 조회 측에 바로 보인다.
 */
@Getter
@Builder
@ToString
public class Player {

    private final String id;         // 고유 플레이어 ID
    private final String name;       // 표시용 이름
    private final String sessionId;  // 재접속용 세션 ID
    private final boolean host;      // 관전만 하는 방장 (역할 없음, 정원 미포함)

    @Builder.Default
    private final Instant joinedAt = Instant.now();

    private volatile Card role;           // 배정된 역할 카드
    private volatile boolean roleRevealed; // 리더는 배정 즉시 공개

    public static Player create(String name, String sessionId) {
        return Player.builder()
                .id(RandomUtil.generatePlayerId())
                .name(name)
                .sessionId(sessionId)
                .build();
    }

    public static Player createHost(String name, String sessionId) {
        return Player.builder()
                .id(RandomUtil.generatePlayerId())
                .name(name)
                .sessionId(sessionId)
                .host(true)
                .build();
    }

    public void assignRole(Card card) {
        this.role = card;
        if (card != null && card.isLeader()) {
            this.roleRevealed = true;
        }
    }

    public boolean hasRole() {
        return role != null;
    }

    public void clearRole() {
        this.role = null;
        this.roleRevealed = false;
    }
}
