package com.copyleft.Treachery.infra.card;

import com.copyleft.Treachery.domain.Card;
import com.copyleft.Treachery.domain.CardPool;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * 클래스패스의 카드 목록(JSON)을 읽어 {@link CardPool} 을 만든다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CardPoolLoader {

    public static final String DEFAULT_LOCATION = "cards/treachery-cards.json";

    private final ObjectMapper objectMapper;

    public CardPool load() {
        return load(DEFAULT_LOCATION);
    }

    public CardPool load(String location) {
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("card catalogue not found on classpath: " + location);
        }

        CardCollection collection;
        try (InputStream in = resource.getInputStream()) {
            collection = objectMapper.readValue(in, CardCollection.class);
        } catch (IOException e) {
            throw new IllegalStateException("failed to parse card catalogue " + location, e);
        }

        List<Card> cards = collection.cards() == null ? List.of() : collection.cards();
        if (collection.cardsCount() != 0 && collection.cardsCount() != cards.size()) {
            log.warn("카드 수 불일치: cards_count={}, 실제={}", collection.cardsCount(), cards.size());
        }

        CardPool pool = CardPool.of(cards);
        log.info("카드 로드 완료: set={}, leader={}, guardian={}, assassin={}, traitor={}",
                collection.setName(), pool.getLeaders().size(), pool.getGuardians().size(),
                pool.getAssassins().size(), pool.getTraitors().size());
        return pool;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CardCollection(
            @JsonProperty("game_variant") String gameVariant,
            @JsonProperty("set_name") String setName,
            @JsonProperty("set_code") String setCode,
            @JsonProperty("cards_count") int cardsCount,
            List<Card> cards
    ) {}
}
