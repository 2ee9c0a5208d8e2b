package com.example.cardclash.controller;

import com.example.cardclash.model.dto.JoinQueueRequest;
import com.example.cardclash.model.dto.MatchmakingStatus;
import com.example.cardclash.model.dto.QueueState;
import com.example.cardclash.service.MatchmakingService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;

@RestController
@RequestMapping("/api/matchmaking")
public class MatchmakingController {

    private final MatchmakingService matchmakingService;

    public MatchmakingController(MatchmakingService matchmakingService) {
        this.matchmakingService = matchmakingService;
    }

    /**
     * 200 with the match id when paired straight away, 202 when waiting in the queue.
     */
    @PostMapping("/join")
    public ResponseEntity<MatchmakingStatus> join(@Valid @RequestBody JoinQueueRequest request, Principal principal) {
        MatchmakingStatus status = matchmakingService.join(principal.getName(), request.getDeckRef());
        HttpStatus httpStatus = status.getStatus() == QueueState.MATCHED ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(httpStatus).body(status);
    }

    @GetMapping("/status")
    public MatchmakingStatus status(Principal principal) {
        return matchmakingService.status(principal.getName());
    }

    @PostMapping("/leave")
    public MatchmakingStatus leave(Principal principal) {
        return matchmakingService.leave(principal.getName());
    }
}
