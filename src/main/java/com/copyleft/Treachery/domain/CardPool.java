package com.copyleft.Treachery.domain;

import com.copyleft.Treachery.domain.type.RoleType;
import com.copyleft.Treachery.global.util.RandomSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 역할 타입별로 나뉜 카드 묶음. 시작 시 한 번 만들어지고 이후 변경되지 않는다.
 * 모든 방이 같은 인스턴스를 공유한다.
 */
@Slf4j
public final class CardPool {

    private final Map<RoleType, List<Card>> cardsByType;

    private CardPool(Map<RoleType, List<Card>> cardsByType) {
        this.cardsByType = cardsByType;
    }

    public static CardPool of(Collection<Card> cards) {
        Map<RoleType, List<Card>> grouped = new EnumMap<>(RoleType.class);
        for (RoleType type : RoleType.values()) {
            grouped.put(type, new ArrayList<>());
        }

        for (Card card : cards) {
            RoleType roleType = card.getRoleType();
            if (roleType == null) {
                log.debug("역할 타입이 없는 카드 제외: {}", card.getName());
                continue;
            }
            grouped.get(roleType).add(card);
        }

        Map<RoleType, List<Card>> frozen = new EnumMap<>(RoleType.class);
        grouped.forEach((type, list) -> frozen.put(type, List.copyOf(list)));
        return new CardPool(Collections.unmodifiableMap(frozen));
    }

    public static CardPool empty() {
        return of(List.of());
    }

    public List<Card> getCards(RoleType roleType) {
        return cardsByType.getOrDefault(roleType, List.of());
    }

    public List<Card> getLeaders() {
        return getCards(RoleType.LEADER);
    }

    public List<Card> getGuardians() {
        return getCards(RoleType.GUARDIAN);
    }

    public List<Card> getAssassins() {
        return getCards(RoleType.ASSASSIN);
    }

    public List<Card> getTraitors() {
        return getCards(RoleType.TRAITOR);
    }

    public int size() {
        return cardsByType.values().stream().mapToInt(List::size).sum();
    }

    public Optional<Card> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return cardsByType.values().stream()
                .flatMap(List::stream)
                .filter(card -> name.equals(card.getName()))
                .findFirst();
    }

    /**
     * 해당 타입에서 중복 없이 count 장을 무작위로 뽑는다. 풀보다 많이 요청하면 풀 크기만큼만 반환.
     */
    public List<Card> getRandomCards(RoleType roleType, int count, RandomSource random) {
        List<Card> copy = new ArrayList<>(getCards(roleType));
        random.shuffle(copy);
        return List.copyOf(copy.subList(0, Math.min(Math.max(count, 0), copy.size())));
    }
}
