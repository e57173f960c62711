package com.copyleft.Treachery.feature.role;

import com.copyleft.Treachery.config.GameProperties;
import com.copyleft.Treachery.config.RoleProperties;
import com.copyleft.Treachery.config.RoleProperties.Preset;
import com.copyleft.Treachery.config.RoleProperties.RoleDefinition;
import com.copyleft.Treachery.domain.Card;
import com.copyleft.Treachery.domain.CardPool;
import com.copyleft.Treachery.domain.RoleConfiguration;
import com.copyleft.Treachery.domain.RoleTypeConfig;
import com.copyleft.Treachery.domain.type.RoleType;
import com.copyleft.Treachery.global.constant.ErrorCode;
import com.copyleft.Treachery.global.exception.GameException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 역할 설정 -> 역할별 인원 수 계산, 프리셋 자동 조정, 설정 검증.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleConfigService {

    public static final String CUSTOM_NO_AUTO_SCALE = "Custom configurations do not support auto-scaling";

    private static final Map<String, Integer> CATEGORY_ORDER = Map.of(
            "Leader", 1,
            "Good", 2,
            "Guardian", 3,
            "Evil", 4,
            "Traitor", 5,
            "Assassin", 6
    );

    private final GameProperties gameProperties;
    private final RoleProperties roleProperties;
    private final CardPool cardPool;

    public record NamedRole(String name, RoleDefinition definition) {}

    /**
     * 서버 설정과 프리셋 표의 정합성을 시작 시점에 확인한다.
     */
    @PostConstruct
    public void validateSettings() {
        if (gameProperties.maxPlayersPerRoom() < 1) {
            throw new IllegalStateException("maxPlayersPerRoom must be at least 1");
        }
        if (gameProperties.minPlayersPerRoom() < 1) {
            throw new IllegalStateException("minPlayersPerRoom must be at least 1");
        }
        if (gameProperties.minPlayersPerRoom() > gameProperties.maxPlayersPerRoom()) {
            throw new IllegalStateException("minPlayersPerRoom cannot be greater than maxPlayersPerRoom");
        }
        if (gameProperties.roomCodeLength() < 3) {
            throw new IllegalStateException("roomCodeLength must be at least 3");
        }

        boolean hasLeader = false;
        for (Map.Entry<String, RoleDefinition> entry : roleProperties.available().entrySet()) {
            RoleDefinition definition = entry.getValue();
            if (definition.minCount() > definition.maxCount()) {
                throw new IllegalStateException("role " + entry.getKey() + ": minCount cannot be greater than maxCount");
            }
            if (RoleType.LEADER.getDisplayName().equals(definition.category())) {
                hasLeader = true;
            }
        }
        if (!hasLeader) {
            throw new IllegalStateException("at least one Leader role must be defined");
        }

        roleProperties.presets().forEach((presetName, preset) ->
                preset.distributions().forEach((playerCount, distribution) -> {
                    if (playerCount < 1 || playerCount > gameProperties.maxPlayersPerRoom()) {
                        throw new IllegalStateException("preset " + presetName + ": invalid player count " + playerCount);
                    }
                    for (String roleName : distribution.keySet()) {
                        if (roleProperties.getRoleDefinition(roleName).isEmpty()) {
                            throw new IllegalStateException("preset " + presetName + ": unknown role " + roleName);
                        }
                    }
                    RoleDistribution resolved;
                    try {
                        resolved = toDistribution(distribution);
                    } catch (GameException e) {
                        throw new IllegalStateException("preset " + presetName + ": " + e.getMessage(), e);
                    }
                    if (resolved.get(RoleType.LEADER) > 1) {
                        throw new IllegalStateException("preset " + presetName + ": more than 1 leader for " + playerCount + " players");
                    }
                }));

        log.info("역할 설정 로드 완료: roles={}, presets={}", roleProperties.available().keySet(), getPresetNames());
    }

    public List<String> getPresetNames() {
        return roleProperties.presets().keySet().stream().sorted().toList();
    }

    public List<String> getHiddenPresetCandidates() {
        return roleProperties.hiddenPresets();
    }

    public RoleConfiguration createFromPreset(String presetName, int maxPlayers) {
        Preset preset = findPreset(presetName);

        int minPlayers = maxPlayers;
        for (Integer playerCount : preset.distributions().keySet()) {
            minPlayers = Math.min(minPlayers, playerCount);
        }

        RoleConfiguration config = RoleConfiguration.builder()
                .presetName(presetName)
                .minPlayers(minPlayers)
                .maxPlayers(maxPlayers)
                .roleTypes(allCardsEnabled())
                .build();

        Map<String, Integer> distribution = preset.distributions().get(maxPlayers);
        if (distribution != null) {
            toDistribution(distribution).asMap().forEach(config::setCount);
        }
        return config;
    }

    public RoleConfiguration createDefaultConfiguration() {
        RoleConfiguration config = RoleConfiguration.builder()
                .presetName(RoleConfiguration.CUSTOM_PRESET)
                .minPlayers(gameProperties.minPlayersPerRoom())
                .maxPlayers(gameProperties.maxPlayersPerRoom())
                .roleTypes(allCardsEnabled())
                .build();
        config.setCount(RoleType.LEADER, 1);
        return config;
    }

    /**
     * 실제 인원 수에 맞는 역할별 인원을 계산한다.
     * custom 은 설정값 그대로, 프리셋은 가장 가까운 분포를 가디언 수로 맞춘다.
     */
    public RoleDistribution getDistributionForPlayerCount(RoleConfiguration config, int playerCount) {
        if (config == null) {
            throw new GameException(ErrorCode.INVALID_ROLE_CONFIG, "configuration is nil");
        }

        if (config.isCustom()) {
            RoleDistribution configured = configuredCounts(config);
            int leaderCount = configured.get(RoleType.LEADER);
            if (leaderCount > 1) {
                throw new GameException(ErrorCode.INVALID_ROLE_CONFIG,
                        "cannot have more than 1 leader, got " + leaderCount);
            }
            if (configured.total() > playerCount) {
                throw new GameException(ErrorCode.TOO_MANY_ROLES,
                        String.format("too many roles (%d) for player count (%d)", configured.total(), playerCount));
            }
            return configured;
        }

        Preset preset = findPreset(config.getPresetName());

        Map<String, Integer> exact = preset.distributions().get(playerCount);
        if (exact != null) {
            RoleDistribution.Builder builder = toBuilder(exact);
            ensureLeader(builder, config, playerCount);
            return builder.build();
        }

        Integer nearest = findNearestPlayerCount(preset, playerCount);
        RoleDistribution.Builder builder = nearest != null
                ? toBuilder(preset.distributions().get(nearest))
                : configuredBuilder(config);

        int total = builder.total();
        if (total < playerCount) {
            builder.add(RoleType.GUARDIAN, playerCount - total);
        } else if (total > playerCount) {
            if (nearest == null) {
                throw new GameException(ErrorCode.TOO_MANY_ROLES,
                        String.format("too many roles (%d) for player count (%d)", total, playerCount));
            }
            // 가디언만 줄인다 (최소 1명 유지)
            while (total > playerCount && builder.get(RoleType.GUARDIAN) > 1) {
                builder.add(RoleType.GUARDIAN, -1);
                total--;
            }
        }

        ensureLeader(builder, config, playerCount);
        return builder.build();
    }

    public AutoScaleResult canAutoScale(RoleConfiguration config, int targetPlayers) {
        if (config.isCustom()) {
            return AutoScaleResult.notScalable(CUSTOM_NO_AUTO_SCALE);
        }

        Preset preset = roleProperties.getPreset(config.getPresetName()).orElse(null);
        if (preset == null) {
            return AutoScaleResult.notScalable(String.format("Preset '%s' not found", config.getPresetName()));
        }

        if (preset.distributions().containsKey(targetPlayers)) {
            return AutoScaleResult.scalable(String.format("Can scale from %d to %d players using %s preset",
                    config.totalConfiguredRoles(), targetPlayers, config.getPresetName()));
        }

        Integer nearest = findNearestPlayerCount(preset, targetPlayers);
        if (nearest == null) {
            return AutoScaleResult.notScalable(String.format("Preset '%s' has no distributions", config.getPresetName()));
        }

        int nearestTotal = toDistribution(preset.distributions().get(nearest)).total();
        if (nearestTotal < targetPlayers) {
            return AutoScaleResult.scalable(String.format(
                    "Can scale to %d players by adding %d guardian role(s) to %d-player %s preset",
                    targetPlayers, targetPlayers - nearestTotal, nearest, config.getPresetName()));
        }
        return AutoScaleResult.scalable(String.format("Can scale to %d players by adapting %d-player %s preset",
                targetPlayers, nearest, config.getPresetName()));
    }

    public void validateConfiguration(RoleConfiguration config) {
        if (config == null) {
            throw new GameException(ErrorCode.INVALID_ROLE_CONFIG, "configuration is nil");
        }

        int leaderCount = config.getCount(RoleType.LEADER);
        if (leaderCount > 1) {
            throw new GameException(ErrorCode.INVALID_ROLE_CONFIG,
                    "cannot have more than 1 leader, got " + leaderCount);
        }

        for (RoleType roleType : RoleType.DEALING_ORDER) {
            RoleTypeConfig typeConfig = config.getRoleTypeConfig(roleType);
            if (typeConfig == null || typeConfig.getCount() == 0) {
                continue;
            }
            if (typeConfig.getCount() < 0) {
                throw new GameException(ErrorCode.INVALID_ROLE_CONFIG,
                        String.format("%s: count must not be negative, got %d", roleType.getDisplayName(), typeConfig.getCount()));
            }

            int enabledCount = typeConfig.allCardsEnabled()
                    ? cardPool.getCards(roleType).size()
                    : typeConfig.getEnabledCards().size();
            if (typeConfig.getCount() > enabledCount) {
                throw new GameException(ErrorCode.INVALID_ROLE_CONFIG,
                        String.format("%s: need %d cards but only %d are enabled",
                                roleType.getDisplayName(), typeConfig.getCount(), enabledCount));
            }
        }

        if (leaderCount == 0 && !config.isAllowLeaderlessGame()) {
            throw new GameException(ErrorCode.INVALID_ROLE_CONFIG, "must have a leader role");
        }

        if (config.getMinPlayers() < gameProperties.minPlayersPerRoom()) {
            throw new GameException(ErrorCode.INVALID_ROLE_CONFIG,
                    String.format("minimum players %d is less than server minimum %d",
                            config.getMinPlayers(), gameProperties.minPlayersPerRoom()));
        }
        if (config.getMaxPlayers() > gameProperties.maxPlayersPerRoom()) {
            throw new GameException(ErrorCode.INVALID_ROLE_CONFIG,
                    String.format("maximum players %d exceeds server maximum %d",
                            config.getMaxPlayers(), gameProperties.maxPlayersPerRoom()));
        }
    }

    /**
     * 항상 공개되는 역할 먼저, 그다음 카테고리 순서, 마지막으로 표시 이름 순.
     */
    public List<NamedRole> getSortedRoles() {
        Comparator<NamedRole> byRevealed = Comparator.comparing(role -> !role.definition().alwaysRevealed());
        Comparator<NamedRole> byCategory = Comparator.comparing(
                role -> CATEGORY_ORDER.getOrDefault(role.definition().category(), Integer.MAX_VALUE));
        Comparator<NamedRole> byCategoryName = Comparator.comparing(
                role -> role.definition().category() == null ? "" : role.definition().category());
        Comparator<NamedRole> byDisplayName = Comparator.comparing(
                role -> role.definition().displayName() == null ? "" : role.definition().displayName());

        return roleProperties.available().entrySet().stream()
                .map(entry -> new NamedRole(entry.getKey(), entry.getValue()))
                .sorted(byRevealed.thenComparing(byCategory).thenComparing(byCategoryName).thenComparing(byDisplayName))
                .toList();
    }

    private Preset findPreset(String presetName) {
        return roleProperties.getPreset(presetName).orElseThrow(() ->
                new GameException(ErrorCode.PRESET_NOT_FOUND, String.format("preset '%s' not found", presetName)));
    }

    // 동률이면 작은 인원 수 (distributions 는 오름차순)
    private Integer findNearestPlayerCount(Preset preset, int playerCount) {
        Integer nearest = null;
        int nearestDiff = Integer.MAX_VALUE;
        for (Integer count : preset.distributions().keySet()) {
            int diff = Math.abs(playerCount - count);
            if (diff < nearestDiff) {
                nearestDiff = diff;
                nearest = count;
            }
        }
        return nearest;
    }

    private void ensureLeader(RoleDistribution.Builder builder, RoleConfiguration config, int playerCount) {
        if (builder.get(RoleType.LEADER) > 0 || config.isAllowLeaderlessGame()) {
            return;
        }
        builder.set(RoleType.LEADER, 1);
        if (builder.total() > playerCount && builder.get(RoleType.GUARDIAN) > 1) {
            builder.add(RoleType.GUARDIAN, -1);
        }
    }

    public RoleDistribution configuredCounts(RoleConfiguration config) {
        return configuredBuilder(config).build();
    }

    private RoleDistribution.Builder configuredBuilder(RoleConfiguration config) {
        RoleDistribution.Builder builder = RoleDistribution.builder();
        for (RoleType roleType : RoleType.DEALING_ORDER) {
            builder.set(roleType, config.getCount(roleType));
        }
        return builder;
    }

    private RoleDistribution toDistribution(Map<String, Integer> distribution) {
        return toBuilder(distribution).build();
    }

    private RoleDistribution.Builder toBuilder(Map<String, Integer> distribution) {
        RoleDistribution.Builder builder = RoleDistribution.builder();
        distribution.forEach((roleName, count) -> builder.add(resolveRoleType(roleName), count));
        return builder;
    }

    // 프리셋 키 ("leader") -> 역할 정의의 카테고리 -> RoleType
    private RoleType resolveRoleType(String roleName) {
        return roleProperties.getRoleDefinition(roleName)
                .flatMap(definition -> RoleType.find(definition.category()))
                .orElseGet(() -> RoleType.fromName(roleName));
    }

    private Map<RoleType, RoleTypeConfig> allCardsEnabled() {
        Map<RoleType, RoleTypeConfig> roleTypes = new EnumMap<>(RoleType.class);
        for (RoleType roleType : RoleType.DEALING_ORDER) {
            RoleTypeConfig typeConfig = new RoleTypeConfig();
            for (Card card : cardPool.getCards(roleType)) {
                typeConfig.getEnabledCards().add(card.getName());
            }
            roleTypes.put(roleType, typeConfig);
        }
        return roleTypes;
    }
}
