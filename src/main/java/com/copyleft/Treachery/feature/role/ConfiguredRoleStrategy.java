package com.copyleft.Treachery.feature.role;

import com.copyleft.Treachery.domain.Card;
import com.copyleft.Treachery.domain.CardPool;
import com.copyleft.Treachery.domain.RoleConfiguration;
import com.copyleft.Treachery.domain.type.RoleType;
import com.copyleft.Treachery.global.exception.GameException;
import com.copyleft.Treachery.global.util.RandomSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 방의 역할 설정을 따르는 분포 결정.
 * 숨김 모드 -> 완전 랜덤 모드 -> 설정(custom 은 그대로, 프리셋은 자동 조정) 순으로 판단한다.
 */
@Slf4j
@RequiredArgsConstructor
public class ConfiguredRoleStrategy implements RoleDistributionStrategy {

    // 완전 랜덤 모드 가중치
    static final Map<RoleType, Integer> RANDOM_WEIGHTS = weights();

    private final RoleConfiguration config;
    private final RoleConfigService roleConfigService;
    private final RandomSource random;

    @Override
    public RoleDistribution resolve(int activePlayerCount, CardPool cardPool) {
        if (config.isHideRoleDistribution()) {
            return resolveHidden(activePlayerCount);
        }
        if (config.isFullyRandomRoles()) {
            return resolveFullyRandom(activePlayerCount, cardPool);
        }

        try {
            return roleConfigService.getDistributionForPlayerCount(config, activePlayerCount);
        } catch (GameException e) {
            log.warn("역할 분포 계산 실패, 설정값 그대로 사용: preset={}, players={}, reason={}",
                    config.getPresetName(), activePlayerCount, e.getMessage());
            return cappedConfiguredCounts();
        }
    }

    // 리더는 설정값과 관계없이 최대 1명
    private RoleDistribution cappedConfiguredCounts() {
        RoleDistribution configured = roleConfigService.configuredCounts(config);
        RoleDistribution.Builder builder = RoleDistribution.builder();
        for (RoleType roleType : RoleType.DEALING_ORDER) {
            builder.set(roleType, configured.get(roleType));
        }
        builder.set(RoleType.LEADER, Math.min(configured.get(RoleType.LEADER), 1));
        return builder.build();
    }

    /**
     * 활성화 카드 목록으로 거른다. 목록이 비어 있거나 풀과 하나도 겹치지 않으면 타입 전체.
     */
    @Override
    public List<Card> eligibleCards(RoleType roleType, CardPool cardPool) {
        List<Card> all = cardPool.getCards(roleType);
        Set<String> enabled = config.getEnabledCards(roleType);
        if (enabled.isEmpty()) {
            return all;
        }

        List<Card> filtered = all.stream()
                .filter(card -> enabled.contains(card.getName()))
                .toList();
        if (filtered.isEmpty()) {
            log.debug("활성화된 {} 카드가 풀에 없음, 전체 카드 사용", roleType.getDisplayName());
            return all;
        }
        return filtered;
    }

    private RoleDistribution resolveHidden(int playerCount) {
        List<String> candidates = roleConfigService.getHiddenPresetCandidates();
        if (candidates.isEmpty()) {
            log.warn("숨김 모드 프리셋 후보 없음, 기본 분포 사용: players={}", playerCount);
            return leaderAndGuardians(playerCount);
        }

        String selected = random.pick(candidates);
        log.info("숨김 분포 모드: preset={}, players={}", selected, playerCount);

        RoleConfiguration hidden = config.copy();
        hidden.setPresetName(selected);
        try {
            return roleConfigService.getDistributionForPlayerCount(hidden, playerCount);
        } catch (GameException e) {
            log.warn("숨김 모드 프리셋 적용 실패, 기본 분포 사용: preset={}, reason={}", selected, e.getMessage());
            return leaderAndGuardians(playerCount);
        }
    }

    private RoleDistribution resolveFullyRandom(int playerCount, CardPool cardPool) {
        Map<RoleType, Integer> capacity = new EnumMap<>(RoleType.class);
        for (RoleType roleType : RoleType.DEALING_ORDER) {
            capacity.put(roleType, eligibleCards(roleType, cardPool).size());
        }

        RoleDistribution.Builder builder = RoleDistribution.builder();
        if (!config.isAllowLeaderlessGame() && playerCount > 0 && capacity.get(RoleType.LEADER) > 0) {
            builder.set(RoleType.LEADER, 1);
        }

        while (builder.total() < playerCount) {
            List<RoleType> pool = new ArrayList<>();
            RANDOM_WEIGHTS.forEach((roleType, weight) -> {
                if (canDraw(roleType, builder, capacity)) {
                    for (int i = 0; i < weight; i++) {
                        pool.add(roleType);
                    }
                }
            });
            if (pool.isEmpty()) {
                log.warn("완전 랜덤 모드: 남은 카드 없음, {}명 중 {}명만 배정", playerCount, builder.total());
                break;
            }
            builder.add(random.pick(pool), 1);
        }

        RoleDistribution distribution = builder.build();
        log.info("완전 랜덤 분포 생성: {}", distribution);
        return distribution;
    }

    private boolean canDraw(RoleType roleType, RoleDistribution.Builder builder, Map<RoleType, Integer> capacity) {
        if (roleType == RoleType.LEADER && builder.get(RoleType.LEADER) >= 1) {
            return false;
        }
        return builder.get(roleType) < capacity.get(roleType);
    }

    private static RoleDistribution leaderAndGuardians(int playerCount) {
        if (playerCount < 1) {
            return RoleDistribution.empty();
        }
        return RoleDistribution.builder()
                .set(RoleType.LEADER, 1)
                .set(RoleType.GUARDIAN, playerCount - 1)
                .build();
    }

    private static Map<RoleType, Integer> weights() {
        Map<RoleType, Integer> weights = new EnumMap<>(RoleType.class);
        weights.put(RoleType.LEADER, 1);
        weights.put(RoleType.GUARDIAN, 3);
        weights.put(RoleType.ASSASSIN, 2);
        weights.put(RoleType.TRAITOR, 1);
        return Collections.unmodifiableMap(weights);
    }
}
