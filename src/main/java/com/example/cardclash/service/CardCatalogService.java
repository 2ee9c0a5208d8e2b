package com.example.cardclash.service;

import com.example.cardclash.common.CardNotFoundException;
import com.example.cardclash.config.CardClashProperties;
import com.example.cardclash.logic.CardInstanceHydrator;
import com.example.cardclash.model.domain.AbilityDescriptor;
import com.example.cardclash.model.domain.InGameCard;
import com.example.cardclash.model.domain.Power;
import com.example.cardclash.model.entity.CardInstanceEntity;
import com.example.cardclash.repository.CardInstanceRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;

/**
 * Hydrates card instances from the collection tables.
 * <p>
 * Current power = base power + (level - 1) x level bonus + the instance's permanent bonuses.
 */
@Slf4j
@Service
public class CardCatalogService implements CardInstanceHydrator {

    private final CardInstanceRepository cardInstanceRepository;
    private final ObjectMapper objectMapper;
    private final int levelBonusPerLevel;

    public CardCatalogService(CardInstanceRepository cardInstanceRepository,
                              ObjectMapper objectMapper,
                              CardClashProperties properties) {
        this.cardInstanceRepository = cardInstanceRepository;
        this.objectMapper = objectMapper;
        this.levelBonusPerLevel = properties.getCards().getLevelBonusPerLevel();
    }

    @Override
    @Transactional(readOnly = true)
    public InGameCard resolve(String cardInstanceId, String ownerUserId) {
        CardInstanceEntity entity = cardInstanceRepository.findById(cardInstanceId)
                .orElseThrow(() -> new CardNotFoundException(cardInstanceId));
        if (ownerUserId != null && !ownerUserId.equals(entity.getOwnerUserId())) {
            throw new CardNotFoundException(cardInstanceId);
        }

        Power base = new Power(entity.getBaseTop(), entity.getBaseRight(), entity.getBaseBottom(), entity.getBaseLeft());
        Power bonus = new Power(entity.getBonusTop(), entity.getBonusRight(), entity.getBonusBottom(), entity.getBonusLeft());
        int level = Math.max(1, entity.getLevel());
        Power current = base.shift((level - 1) * levelBonusPerLevel).plus(bonus);

        return new InGameCard(entity.getId(), entity.getCardId(), entity.getOwnerUserId(), entity.getName(),
                entity.getRarity(), level, base, current, parseTags(entity.getTags()), parseAbility(entity));
    }

    private List<String> parseTags(String tags) {
        if (tags == null || tags.isBlank()) {
            return List.of();
        }
        return Arrays.stream(tags.split(",")).map(String::trim).filter(t -> !t.isEmpty()).toList();
    }

    private AbilityDescriptor parseAbility(CardInstanceEntity entity) {
        if (entity.getAbilityJson() == null || entity.getAbilityJson().isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(entity.getAbilityJson(), AbilityDescriptor.class);
        } catch (JsonProcessingException e) {
            // The card still plays, just without its ability
            log.warn("Card {} has an unreadable ability definition: {}", entity.getId(), e.getOriginalMessage());
            return null;
        }
    }
}
