package com.copyleft.Treachery.global.util;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 셔플, 프리셋 선택, 랜덤 역할 풀에 쓰이는 난수 공급원.
 * 운영에서는 {@link #threadLocal()}, 테스트에서는 {@link #seeded(long)} 를 주입한다.
 */
public interface RandomSource {

    /**
     * @return 0 이상 bound 미만의 정수
     */
    int nextInt(int bound);

    /**
     * Fisher-Yates 셔플 (제자리)
     */
    default <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            int j = nextInt(i + 1);
            Collections.swap(list, i, j);
        }
    }

    default <T> T pick(List<T> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return candidates.get(nextInt(candidates.size()));
    }

    static RandomSource threadLocal() {
        return bound -> ThreadLocalRandom.current().nextInt(bound);
    }

    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return random::nextInt;
    }
}
