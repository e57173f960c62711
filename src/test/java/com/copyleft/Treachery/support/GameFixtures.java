package com.copyleft.Treachery.support;

import com.copyleft.Treachery.config.GameProperties;
import com.copyleft.Treachery.config.RoleProperties;
import com.copyleft.Treachery.config.RoleProperties.Preset;
import com.copyleft.Treachery.config.RoleProperties.RoleDefinition;
import com.copyleft.Treachery.domain.Card;
import com.copyleft.Treachery.domain.CardPool;
import com.copyleft.Treachery.domain.Player;
import com.copyleft.Treachery.domain.RoleConfiguration;
import com.copyleft.Treachery.domain.type.RoleType;
import com.copyleft.Treachery.feature.role.RoleConfigService;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 테스트 공용 설정, 카드 풀, 플레이어.
 */
public final class GameFixtures {

    private GameFixtures() {
    }

    public static GameProperties gameProperties() {
        return new GameProperties(1, 20, 5, 5, 5);
    }

    public static RoleProperties roleProperties() {
        return roleProperties(List.of("standard"));
    }

    public static RoleProperties roleProperties(List<String> hiddenPresets) {
        Map<String, RoleDefinition> available = new LinkedHashMap<>();
        available.put("traitor", new RoleDefinition("Traitor", "Traitor", 0, 10, false));
        available.put("assassin", new RoleDefinition("Assassin", "Assassin", 0, 10, false));
        available.put("guardian", new RoleDefinition("Guardian", "Guardian", 0, 10, false));
        available.put("leader", new RoleDefinition("Leader", "Leader", 1, 1, true));

        Map<String, Preset> presets = new LinkedHashMap<>();
        presets.put("standard", new Preset("Standard", "Balanced gameplay", standardDistributions()));

        // 4인, 6인 분포만 있는 프리셋 (자동 조정 확인용)
        Map<Integer, Map<String, Integer>> scale = new LinkedHashMap<>();
        scale.put(6, Map.of("leader", 1, "guardian", 2, "assassin", 2, "traitor", 1));
        scale.put(4, Map.of("leader", 1, "guardian", 2, "traitor", 1));
        presets.put("scale", new Preset("Scale", "Only four and six", scale));

        presets.put("noleader", new Preset("No Leader", "Leader omitted",
                Map.of(3, Map.of("guardian", 2, "traitor", 1))));
        presets.put("empty", new Preset("Empty", "No distributions", Map.of()));

        return new RoleProperties(available, presets, hiddenPresets);
    }

    public static Map<Integer, Map<String, Integer>> standardDistributions() {
        Map<Integer, Map<String, Integer>> standard = new LinkedHashMap<>();
        standard.put(1, Map.of("leader", 1));
        standard.put(2, Map.of("leader", 1, "traitor", 1));
        standard.put(3, Map.of("leader", 1, "guardian", 1, "traitor", 1));
        standard.put(4, Map.of("leader", 1, "guardian", 2, "traitor", 1));
        standard.put(5, Map.of("leader", 1, "guardian", 2, "assassin", 1, "traitor", 1));
        standard.put(6, Map.of("leader", 1, "guardian", 2, "assassin", 2, "traitor", 1));
        standard.put(7, Map.of("leader", 1, "guardian", 3, "assassin", 2, "traitor", 1));
        standard.put(8, Map.of("leader", 1, "guardian", 3, "assassin", 2, "traitor", 2));
        return standard;
    }

    /**
     * 리더 2, 가디언 10, 암살자 4, 배신자 4장.
     */
    public static CardPool cardPool() {
        List<Card> cards = new ArrayList<>();
        cards.add(Card.of("The Blood Empress", RoleType.LEADER));
        cards.add(Card.of("The Rightful Heir", RoleType.LEADER));
        for (int i = 1; i <= 10; i++) {
            cards.add(Card.of("Guardian " + i, RoleType.GUARDIAN));
        }
        for (int i = 1; i <= 4; i++) {
            cards.add(Card.of("Assassin " + i, RoleType.ASSASSIN));
            cards.add(Card.of("Traitor " + i, RoleType.TRAITOR));
        }
        return CardPool.of(cards);
    }

    public static RoleConfigService roleConfigService() {
        return new RoleConfigService(gameProperties(), roleProperties(), cardPool());
    }

    public static RoleConfigService roleConfigService(RoleProperties roleProperties) {
        return new RoleConfigService(gameProperties(), roleProperties, cardPool());
    }

    /**
     * 활성화 카드 제한이 없는 custom 설정.
     */
    public static RoleConfiguration customConfig(int leaders, int guardians, int assassins, int traitors) {
        RoleConfiguration config = RoleConfiguration.builder()
                .minPlayers(1)
                .maxPlayers(20)
                .build();
        config.setCount(RoleType.LEADER, leaders);
        config.setCount(RoleType.GUARDIAN, guardians);
        config.setCount(RoleType.ASSASSIN, assassins);
        config.setCount(RoleType.TRAITOR, traitors);
        return config;
    }

    public static List<Player> players(int count) {
        List<Player> players = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            players.add(Player.create("player" + i, "session-" + i));
        }
        return players;
    }
}
