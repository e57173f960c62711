package com.copyleft.Treachery.feature.role;

import com.copyleft.Treachery.domain.Card;
import com.copyleft.Treachery.domain.CardPool;
import com.copyleft.Treachery.domain.type.RoleType;

import java.util.List;

/**
 * 활성 인원 수 -> 역할 분포 결정 방식.
 * 카드 분배 자체는 {@link RoleAssigner} 가 공통으로 처리한다.
 */
public interface RoleDistributionStrategy {

    RoleDistribution resolve(int activePlayerCount, CardPool cardPool);

    /**
     * 해당 역할 타입에서 분배 가능한 카드. 기본은 풀의 전체 카드.
     */
    default List<Card> eligibleCards(RoleType roleType, CardPool cardPool) {
        return cardPool.getCards(roleType);
    }
}
