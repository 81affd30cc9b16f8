package com.venue.scout.recommender.service.cooldown;

import com.venue.scout.recommender.common.constants.CooldownProperties;
import com.venue.scout.recommender.enums.RecommendationStatus;
import com.venue.scout.recommender.model.documents.RecommendationRecord;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Resurfacing rules for persisted records. Pure: decisions depend only on the record, the
 * configured cooldowns and the instant passed in.
 */
@Component
public class CooldownPolicy {

    private final CooldownProperties props;

    public CooldownPolicy(CooldownProperties props) {
        this.props = props;
    }

    /**
     * Whether {@code load} may return the record: pending, or declined/viewed/expired past the
     * matching cooldown, never terminal, not past {@code expiresAt} and created within the
     * freshness window.
     */
    public boolean isLoadable(RecommendationRecord r, Instant now) {
        if (r == null || r.getStatus() == null || r.getStatus().isTerminal()) return false;
        if (r.isExpiredAt(now)) return false;
        if (r.getCreatedAt() == null || r.getCreatedAt().isBefore(now.minus(props.getFreshnessWindow()))) return false;
        return r.getStatus() == RecommendationStatus.PENDING || cooldownElapsed(r, now);
    }

    /** True once a declined, viewed or expired record may be shown again. */
    public boolean cooldownElapsed(RecommendationRecord r, Instant now) {
        Duration cooldown = cooldownFor(r.getStatus());
        if (cooldown == null) return false;
        if (r.getLastShownAt() == null) return true;
        return !r.getLastShownAt().plus(cooldown).isAfter(now);
    }

    /** Cooldown of a status, or null for statuses that never resurface through cooldown. */
    public Duration cooldownFor(RecommendationStatus status) {
        if (status == null) return null;
        return switch (status) {
            case DECLINED -> props.getDeclined();
            case VIEWED, EXPIRED -> props.getViewedOrExpired();
            case PENDING, ACCEPTED, NOT_INTERESTED -> null;
        };
    }
}
