package com.example.cardclash.logic;

import com.example.cardclash.common.CardNotFoundException;
import com.example.cardclash.model.domain.InGameCard;

/**
 * Resolves an opaque card-instance id into its battle attributes.
 */
@FunctionalInterface
public interface CardInstanceHydrator {

    /**
     * @param ownerUserId when not {@code null}, the instance must belong to this user
     * @throws CardNotFoundException if the instance does not exist or belongs to someone else
     */
    InGameCard resolve(String cardInstanceId, String ownerUserId);
}
