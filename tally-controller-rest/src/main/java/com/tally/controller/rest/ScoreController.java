package com.tally.controller.rest;

import com.tally.service.core.counter.CounterType;
import com.tally.service.core.score.Score;
import com.tally.service.core.score.ScoreQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scores")
public class ScoreController {

    private final ScoreQueryService scoreQueryService;

    public ScoreController(ScoreQueryService scoreQueryService) {
        this.scoreQueryService = scoreQueryService;
    }

    @GetMapping("/{subjectId}/{scopeId}")
    public Score score(
            @PathVariable long subjectId,
            @PathVariable long scopeId,
            @RequestParam(name = "type", required = false) String type) {
        CounterType counterType = type == null || type.isBlank() ? null : CounterType.fromValue(type);
        return scoreQueryService.getScore(subjectId, scopeId, counterType);
    }
}
