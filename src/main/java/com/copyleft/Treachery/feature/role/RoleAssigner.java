package com.copyleft.Treachery.feature.role;

import com.copyleft.Treachery.domain.Card;
import com.copyleft.Treachery.domain.CardPool;
import com.copyleft.Treachery.domain.Player;
import com.copyleft.Treachery.domain.RoleConfiguration;
import com.copyleft.Treachery.domain.type.RoleType;
import com.copyleft.Treachery.global.util.RandomSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 플레이어에게 역할 카드를 나눠준다.
 * 락을 잡지 않으므로 방에 적용할 때는 호출하는 쪽이 방의 쓰기 락을 잡고 있어야 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoleAssigner {

    private final RoleConfigService roleConfigService;
    private final RandomSource random;

    /**
     * 방 설정 기반 배정. 설정이 없으면 기본 분포표를 쓴다.
     */
    public void assignRolesWithConfig(List<Player> players, CardPool cardPool, RoleConfiguration config) {
        if (config == null) {
            assignRoles(players, cardPool);
            return;
        }
        deal(players, cardPool, new ConfiguredRoleStrategy(config, roleConfigService, random));
    }

    public void assignRoles(List<Player> players, CardPool cardPool) {
        deal(players, cardPool, StandardRoleTable.INSTANCE);
    }

    void deal(List<Player> players, CardPool cardPool, RoleDistributionStrategy strategy) {
        List<Player> activePlayers = new ArrayList<>();
        for (Player player : players) {
            if (!player.isHost()) {
                activePlayers.add(player);
            }
        }
        if (activePlayers.isEmpty()) {
            return;
        }

        random.shuffle(activePlayers);

        RoleDistribution distribution = strategy.resolve(activePlayers.size(), cardPool);
        log.debug("역할 분포 확정: players={}, distribution={}", activePlayers.size(), distribution);

        Set<String> usedCards = new HashSet<>();
        int playerIndex = 0;

        // 리더부터 채워야 인원이 모자랄 때도 리더 자리가 빠지지 않는다
        for (RoleType roleType : RoleType.DEALING_ORDER) {
            int needed = distribution.get(roleType);
            if (needed == 0 || playerIndex >= activePlayers.size()) {
                continue;
            }

            List<Card> cards = new ArrayList<>(strategy.eligibleCards(roleType, cardPool));
            random.shuffle(cards);

            int dealt = 0;
            for (Card card : cards) {
                if (dealt >= needed || playerIndex >= activePlayers.size()) {
                    break;
                }
                if (!usedCards.add(card.getName())) {
                    continue;
                }
                Player player = activePlayers.get(playerIndex++);
                player.assignRole(card);
                dealt++;
            }

            if (dealt < needed) {
                log.warn("{} 카드 부족: 필요 {}, 배정 {}", roleType.getDisplayName(), needed, dealt);
            }
        }

        if (playerIndex < activePlayers.size()) {
            log.warn("역할 없이 남은 플레이어 {}명 (분포 합계 {}, 활성 인원 {})",
                    activePlayers.size() - playerIndex, distribution.total(), activePlayers.size());
        }
    }
}
