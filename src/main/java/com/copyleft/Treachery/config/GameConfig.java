package com.copyleft.Treachery.config;

import com.copyleft.Treachery.domain.CardPool;
import com.copyleft.Treachery.global.util.RandomSource;
import com.copyleft.Treachery.infra.card.CardPoolLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GameConfig {

    @Bean
    public RandomSource randomSource() {
        return RandomSource.threadLocal();
    }

    // 모든 방이 공유하는 카드 풀. 시작 시 한 번만 읽는다
    @Bean
    public CardPool cardPool(CardPoolLoader cardPoolLoader) {
        return cardPoolLoader.load();
    }
}
