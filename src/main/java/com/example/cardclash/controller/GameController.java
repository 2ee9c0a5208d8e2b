package com.example.cardclash.controller;

import com.example.cardclash.model.dto.GameStateView;
import com.example.cardclash.service.MatchSessionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;

@RestController
@RequestMapping("/api/matches")
public class GameController {

    private final MatchSessionService matchSessionService;

    public GameController(MatchSessionService matchSessionService) {
        this.matchSessionService = matchSessionService;
    }

    // The caller's view of a live or finished match; 404 for matches they are not part of
    @GetMapping("/{matchId}")
    public GameStateView getMatch(@PathVariable String matchId, Principal principal) {
        return matchSessionService.viewFor(matchId, principal.getName());
    }
}
