package com.copyleft.Treachery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 역할 정의와 프리셋 (인원 수 -> 역할별 인원) 설정.
 */
@ConfigurationProperties(prefix = "game.roles")
public record RoleProperties(
        Map<String, RoleDefinition> available,
        Map<String, Preset> presets,
        List<String> hiddenPresets  // 분포 숨김 모드에서 무작위로 고를 프리셋 후보
) {

    public static final List<String> DEFAULT_HIDDEN_PRESETS = List.of("standard", "assassination", "guardian");

    public RoleProperties {
        available = available == null ? Map.of() : new LinkedHashMap<>(available);
        presets = presets == null ? Map.of() : new LinkedHashMap<>(presets);
        hiddenPresets = hiddenPresets == null || hiddenPresets.isEmpty() ? DEFAULT_HIDDEN_PRESETS : List.copyOf(hiddenPresets);
    }

    public Optional<Preset> getPreset(String name) {
        return Optional.ofNullable(presets.get(name));
    }

    public Optional<RoleDefinition> getRoleDefinition(String name) {
        return Optional.ofNullable(available.get(name));
    }

    public record RoleDefinition(
            String displayName,
            String category,        // "Leader", "Guardian", "Assassin", "Traitor"
            int minCount,
            int maxCount,
            boolean alwaysRevealed
    ) {}

    public record Preset(
            String name,
            String description,
            Map<Integer, Map<String, Integer>> distributions
    ) {
        public Preset {
            // 인원 수 오름차순으로 고정 (가까운 분포 탐색 시 작은 인원 우선)
            distributions = distributions == null ? new TreeMap<>() : new TreeMap<>(distributions);
        }
    }
}
