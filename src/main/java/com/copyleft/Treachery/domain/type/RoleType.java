package com.copyleft.Treachery.domain.type;

import com.copyleft.Treachery.global.constant.ErrorCode;
import com.copyleft.Treachery.global.exception.GameException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Getter
@AllArgsConstructor
public enum RoleType {
    LEADER("Leader", "Survive and be the last player standing"),
    GUARDIAN("Guardian", "Win or lose with the Leader"),
    ASSASSIN("Assassin", "Win if the Leader is eliminated"),
    TRAITOR("Traitor", "Be the last player standing");

    /**
     * 카드 배분 순서. 리더가 항상 먼저 채워진다.
     */
    public static final List<RoleType> DEALING_ORDER = List.of(LEADER, GUARDIAN, ASSASSIN, TRAITOR);

    private final String displayName;
    private final String winCondition;

    /**
     * 카드 subtype ("Leader") 또는 설정 키 ("leader") 로 역할 타입을 찾는다.
     */
    public static Optional<RoleType> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (RoleType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static RoleType fromName(String name) {
        return find(name).orElseThrow(() ->
                new GameException(ErrorCode.UNKNOWN_ROLE_TYPE, "unknown role type '" + name + "'"));
    }
}
