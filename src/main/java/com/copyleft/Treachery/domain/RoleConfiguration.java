package com.copyleft.Treachery.domain;

import com.copyleft.Treachery.domain.type.RoleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * 방 단위 역할 설정. 역할 타입별 인원 수와 활성화된 카드를 가진다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class RoleConfiguration {

    public static final String CUSTOM_PRESET = "custom";

    @Builder.Default
    private String presetName = CUSTOM_PRESET; // "custom" 또는 프리셋 이름

    private int minPlayers;
    private int maxPlayers;

    private boolean allowLeaderlessGame;   // 리더 없는 게임 허용
    private boolean hideRoleDistribution;  // 배정 시 프리셋을 무작위로 골라 분포를 숨김
    private boolean fullyRandomRoles;      // 설정된 인원 수를 무시하고 가중치 랜덤 분포 생성

    @Builder.Default
    private Map<RoleType, RoleTypeConfig> roleTypes = new EnumMap<>(RoleType.class);

    public boolean isCustom() {
        return CUSTOM_PRESET.equals(presetName);
    }

    public RoleTypeConfig getRoleTypeConfig(RoleType roleType) {
        return roleTypes == null ? null : roleTypes.get(roleType);
    }

    public int getCount(RoleType roleType) {
        RoleTypeConfig config = getRoleTypeConfig(roleType);
        return config == null ? 0 : config.getCount();
    }

    public Set<String> getEnabledCards(RoleType roleType) {
        RoleTypeConfig config = getRoleTypeConfig(roleType);
        return config == null || config.getEnabledCards() == null ? Set.of() : config.getEnabledCards();
    }

    public RoleTypeConfig roleType(RoleType roleType) {
        if (roleTypes == null) {
            roleTypes = new EnumMap<>(RoleType.class);
        }
        return roleTypes.computeIfAbsent(roleType, type -> new RoleTypeConfig());
    }

    public void setCount(RoleType roleType, int count) {
        roleType(roleType).setCount(count);
    }

    // 설정 데이터에서 들어오는 문자열 키용. 모르는 타입이면 예외
    public void setCount(String roleTypeName, int count) {
        setCount(RoleType.fromName(roleTypeName), count);
    }

    public void enableCard(RoleType roleType, String cardName) {
        roleType(roleType).getEnabledCards().add(cardName);
    }

    public int totalConfiguredRoles() {
        if (roleTypes == null) {
            return 0;
        }
        return roleTypes.values().stream()
                .mapToInt(config -> Math.max(config.getCount(), 0))
                .sum();
    }

    public boolean hasLeader() {
        return getCount(RoleType.LEADER) > 0;
    }

    public RoleConfiguration copy() {
        Map<RoleType, RoleTypeConfig> copiedTypes = new EnumMap<>(RoleType.class);
        if (roleTypes != null) {
            roleTypes.forEach((type, config) -> copiedTypes.put(type, config.copy()));
        }
        return RoleConfiguration.builder()
                .presetName(presetName)
                .minPlayers(minPlayers)
                .maxPlayers(maxPlayers)
                .allowLeaderlessGame(allowLeaderlessGame)
                .hideRoleDistribution(hideRoleDistribution)
                .fullyRandomRoles(fullyRandomRoles)
                .roleTypes(copiedTypes)
                .build();
    }
}
