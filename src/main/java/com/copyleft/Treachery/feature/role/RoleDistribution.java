package com.copyleft.Treachery.feature.role;

import com.copyleft.Treachery.domain.type.RoleType;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 역할 타입별 확정 인원 수.
 */
@ToString
@EqualsAndHashCode
public final class RoleDistribution {

    private final Map<RoleType, Integer> counts;

    private RoleDistribution(Map<RoleType, Integer> counts) {
        this.counts = Collections.unmodifiableMap(counts);
    }

    public static RoleDistribution empty() {
        return new RoleDistribution(new EnumMap<>(RoleType.class));
    }

    public static RoleDistribution of(Map<RoleType, Integer> counts) {
        Builder builder = builder();
        counts.forEach(builder::set);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int get(RoleType roleType) {
        return counts.getOrDefault(roleType, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<RoleType, Integer> asMap() {
        return counts;
    }

    public static final class Builder {

        private final Map<RoleType, Integer> counts = new EnumMap<>(RoleType.class);

        public Builder set(RoleType roleType, int count) {
            if (count > 0) {
                counts.put(roleType, count);
            } else {
                counts.remove(roleType);
            }
            return this;
        }

        public Builder add(RoleType roleType, int delta) {
            return set(roleType, get(roleType) + delta);
        }

        public int get(RoleType roleType) {
            return counts.getOrDefault(roleType, 0);
        }

        public int total() {
            return counts.values().stream().mapToInt(Integer::intValue).sum();
        }

        public RoleDistribution build() {
            return new RoleDistribution(new EnumMap<>(counts));
        }
    }
}
