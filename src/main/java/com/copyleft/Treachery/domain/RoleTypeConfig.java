package com.copyleft.Treachery.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashSet;
import java.util.Set;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class RoleTypeConfig {

    private int count; // 원하는 인원 수

    // 배분 가능한 카드 이름. 비어 있으면 해당 타입 카드 전체가 대상
    @Builder.Default
    private Set<String> enabledCards = new LinkedHashSet<>();

    public boolean allCardsEnabled() {
        return enabledCards == null || enabledCards.isEmpty();
    }

    public RoleTypeConfig copy() {
        return new RoleTypeConfig(count, enabledCards == null ? new LinkedHashSet<>() : new LinkedHashSet<>(enabledCards));
    }
}
