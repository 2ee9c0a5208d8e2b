package com.example.cardclash.model.entity;

import jakarta.persistence.*;
import lombok.Data;

/**
 * A card owned by a user, as kept by the collection service. Read-only here.
 */
@Entity
@Table(name = "card_instances")
@Data
public class CardInstanceEntity {

    @Id
    private String id;

    private String ownerUserId;
    private String cardId;
    private String name;
    private String rarity;
    private int level = 1;

    private int baseTop;
    private int baseRight;
    private int baseBottom;
    private int baseLeft;

    // Permanent per-instance bonuses bought with power-ups
    private int bonusTop;
    private int bonusRight;
    private int bonusBottom;
    private int bonusLeft;

    private String tags; // comma separated

    @Lob
    @Column(columnDefinition = "TEXT")
    private String abilityJson;
}
