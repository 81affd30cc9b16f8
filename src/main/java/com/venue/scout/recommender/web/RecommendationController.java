package com.venue.scout.recommender.web;

import com.venue.scout.recommender.common.exception.Http;
import com.venue.scout.recommender.model.dto.BlockRequest;
import com.venue.scout.recommender.model.dto.GenerateRequest;
import com.venue.scout.recommender.model.dto.ResponseRequest;
import com.venue.scout.recommender.service.pipeline.RecommendationPipeline;
import com.venue.scout.recommender.service.store.RecommendationStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/recommendations")
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationPipeline pipeline;
    private final RecommendationStore store;

    @PostMapping("/generate")
    public ResponseEntity<?> generate(@Valid @RequestBody GenerateRequest request) {
        return Http.from(pipeline.generate(request));
    }

    @GetMapping("/users/{userId}")
    public ResponseEntity<?> load(@PathVariable("userId") String userId) {
        return Http.from(store.load(userId));
    }

    @GetMapping("/users/{userId}/stats")
    public ResponseEntity<?> stats(@PathVariable("userId") String userId) {
        return Http.from(store.stats(userId));
    }

    @PostMapping("/{id}/viewed")
    public ResponseEntity<?> viewed(@PathVariable("id") String id) {
        return Http.from(store.markViewed(id));
    }

    @PostMapping("/{id}/accepted")
    public ResponseEntity<?> accepted(@PathVariable("id") String id,
                                      @RequestBody(required = false) ResponseRequest body) {
        return Http.from(store.markAccepted(id, body == null ? null : body.scheduleRef()));
    }

    @PostMapping("/{id}/declined")
    public ResponseEntity<?> declined(@PathVariable("id") String id,
                                      @RequestBody(required = false) ResponseRequest body) {
        return Http.from(store.markDeclined(id, body == null ? null : body.reason()));
    }

    @PostMapping("/{id}/not-interested")
    public ResponseEntity<?> notInterested(@PathVariable("id") String id,
                                           @RequestBody(required = false) ResponseRequest body) {
        return Http.from(store.markNotInterested(id, body == null ? null : body.reason()));
    }

    // explicit "give me a fresh batch"
    @PostMapping("/users/{userId}/clear-pending")
    public ResponseEntity<?> clearPending(@PathVariable("userId") String userId) {
        return Http.from(store.clearPending(userId));
    }

    @GetMapping("/users/{userId}/blocked")
    public ResponseEntity<?> blocked(@PathVariable("userId") String userId) {
        return Http.from(store.listBlocked(userId));
    }

    @PostMapping("/users/{userId}/blocked")
    public ResponseEntity<?> block(@PathVariable("userId") String userId, @Valid @RequestBody BlockRequest request) {
        return Http.from(store.block(userId, request.candidateId(), request.candidateName(), request.reason()));
    }

    @DeleteMapping("/users/{userId}/blocked/{candidateId}")
    public ResponseEntity<?> unblock(@PathVariable("userId") String userId,
                                     @PathVariable("candidateId") String candidateId) {
        return Http.from(store.unblock(userId, candidateId));
    }
}
