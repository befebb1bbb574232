package com.dispatchplatform.bureau.controller;

import com.dispatchplatform.bureau.agent.AgentStatus;
import com.dispatchplatform.bureau.dto.AnswerDTO;
import com.dispatchplatform.bureau.dto.BriefingDTO;
import com.dispatchplatform.bureau.dto.PatternsDTO;
import com.dispatchplatform.bureau.dto.PredictionStatsDTO;
import com.dispatchplatform.bureau.dto.QuestionDTO;
import com.dispatchplatform.bureau.memory.Hotspot;
import com.dispatchplatform.bureau.query.BureauQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/bureau/{city}")
public class BureauController {

    private static final Logger log = LoggerFactory.getLogger(BureauController.class);

    private final BureauQueryService queryService;

    public BureauController(BureauQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/agents")
    public Mono<ResponseEntity<List<AgentStatus>>> agents(@PathVariable String city) {
        return queryService.getAgentStatuses(city)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/predictions")
    public Mono<ResponseEntity<PredictionStatsDTO>> predictions(@PathVariable String city) {
        return queryService.getPredictionStats(city)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/patterns")
    public Mono<ResponseEntity<PatternsDTO>> patterns(@PathVariable String city) {
        return queryService.getActivePatterns(city)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/hotspots")
    public Mono<ResponseEntity<List<Hotspot>>> hotspots(@PathVariable String city) {
        return queryService.getHotspots(city)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/ask")
    public Mono<ResponseEntity<AnswerDTO>> ask(@PathVariable String city, @RequestBody QuestionDTO body) {
        if (body.question() == null || body.question().isBlank()) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        log.info("Question received. city={} incidentId={}", city, body.incidentId());
        return queryService.askAgents(city, body.question(), body.incidentId())
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/briefing")
    public Mono<ResponseEntity<BriefingDTO>> briefing(@PathVariable String city) {
        log.info("Briefing requested. city={}", city);
        return queryService.generateBriefing(city)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Briefing endpoint error. city={}", city, e));
    }
}
