package com.venue.scout.recommender.model.documents;

import com.venue.scout.recommender.enums.FeedbackRating;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Thumbs up/down left by a user on a candidate. Written by the feedback ingestion service,
 * only read here.
 */
@Document("feedback_records")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRecord {
    @Id
    private String id;
    @Indexed
    private String userId;
    @Indexed
    private String candidateId;
    private String category;
    private FeedbackRating rating;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    private Instant createdAt;
}
