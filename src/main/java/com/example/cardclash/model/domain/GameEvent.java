package com.example.cardclash.model.domain;

/**
 * Something that happened while applying an action, in the order it happened. Clients replay
 * these as animations.
 *
 * @param playerId       the player the event is attributed to
 * @param cardInstanceId card involved, if any
 * @param position       cell involved, if any
 * @param detail         free-text detail (ability name, new owner, ...)
 */
public record GameEvent(EventType type,
                        String playerId,
                        String cardInstanceId,
                        BoardPosition position,
                        String detail) {

    public static GameEvent of(EventType type, String playerId, String cardInstanceId, BoardPosition position) {
        return new GameEvent(type, playerId, cardInstanceId, position, null);
    }

    public static GameEvent of(EventType type, String playerId, String cardInstanceId,
                               BoardPosition position, String detail) {
        return new GameEvent(type, playerId, cardInstanceId, position, detail);
    }
}
