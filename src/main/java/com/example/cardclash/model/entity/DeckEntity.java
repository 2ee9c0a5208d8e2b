package com.example.cardclash.model.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "decks")
@Data
public class DeckEntity {

    @Id
    private String id;

    private String ownerUserId;
    private String name;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "deck_cards", joinColumns = @JoinColumn(name = "deck_id"))
    @OrderColumn(name = "slot")
    @Column(name = "card_instance_id")
    private List<String> cardInstanceIds = new ArrayList<>();
}
