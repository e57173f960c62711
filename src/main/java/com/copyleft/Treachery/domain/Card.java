package com.copyleft.Treachery.domain;

import com.copyleft.Treachery.domain.type.RoleType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Getter
@Builder
@Jacksonized
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Card {

    private final int id;

    @ToString.Include
    @EqualsAndHashCode.Include
    private final String name;       // 전역 고유, 활성화 키로 사용

    @JsonProperty("name_anchor")
    private final String nameAnchor;
    private final String uri;
    private final String cost;
    private final int cmc;
    private final String color;
    private final String type;       // "Identity — Leader"
    private final CardTypes types;
    private final String rarity;
    private final String text;
    private final String flavor;
    private final String artist;

    @Builder.Default
    private final List<String> rulings = List.of();

    public record CardTypes(String supertype, String subtype) {
    }

    /**
     * subtype 으로부터 역할 타입을 구한다. 알 수 없는 subtype 이면 null.
     */
    @JsonIgnore
    @ToString.Include
    public RoleType getRoleType() {
        if (types == null) {
            return null;
        }
        return RoleType.find(types.subtype()).orElse(null);
    }

    @JsonIgnore
    public boolean isLeader() {
        return getRoleType() == RoleType.LEADER;
    }

    @JsonIgnore
    public String getWinCondition() {
        RoleType roleType = getRoleType();
        return roleType == null ? "" : roleType.getWinCondition();
    }

    public static Card of(String name, RoleType roleType) {
        return Card.builder()
                .name(name)
                .type("Identity — " + roleType.getDisplayName())
                .types(new CardTypes("Identity", roleType.getDisplayName()))
                .build();
    }
}
