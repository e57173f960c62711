package com.copyleft.Treachery.feature.role;

import com.copyleft.Treachery.domain.CardPool;
import com.copyleft.Treachery.domain.type.RoleType;

import java.util.Map;

/**
 * 설정 없이 시작하는 방의 기본 분포표 (1~8명). 그 외 인원은 리더 1 + 나머지 가디언.
 */
public final class StandardRoleTable implements RoleDistributionStrategy {

    public static final StandardRoleTable INSTANCE = new StandardRoleTable();

    private static final Map<Integer, RoleDistribution> TABLE = Map.of(
            1, of(1, 0, 0, 0),
            2, of(1, 0, 0, 1),
            3, of(1, 1, 0, 1),
            4, of(1, 2, 0, 1),
            5, of(1, 2, 1, 1),
            6, of(1, 2, 2, 1),
            7, of(1, 3, 2, 1),
            8, of(1, 3, 2, 2)
    );

    private StandardRoleTable() {
    }

    @Override
    public RoleDistribution resolve(int activePlayerCount, CardPool cardPool) {
        return distributionFor(activePlayerCount);
    }

    public static RoleDistribution distributionFor(int playerCount) {
        if (playerCount < 1) {
            return RoleDistribution.empty();
        }
        RoleDistribution fixed = TABLE.get(playerCount);
        if (fixed != null) {
            return fixed;
        }
        return of(1, playerCount - 1, 0, 0);
    }

    private static RoleDistribution of(int leaders, int guardians, int assassins, int traitors) {
        return RoleDistribution.builder()
                .set(RoleType.LEADER, leaders)
                .set(RoleType.GUARDIAN, guardians)
                .set(RoleType.ASSASSIN, assassins)
                .set(RoleType.TRAITOR, traitors)
                .build();
    }
}
