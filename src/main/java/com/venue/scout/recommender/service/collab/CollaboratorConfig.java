package com.venue.scout.recommender.service.collab;

import com.venue.scout.recommender.bus.EventPublisher;
import com.venue.scout.recommender.model.profile.PersonalSignals;
import com.venue.scout.recommender.repo.documents.UserProfileRepo;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Default collaborator wiring. A bean of the same type declared elsewhere replaces the default.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean(UserProfileProvider.class)
    public UserProfileProvider userProfileProvider(UserProfileRepo repo) {
        return new MongoUserProfileProvider(repo);
    }

    @Bean
    @ConditionalOnMissingBean(CommitmentProvider.class)
    public CommitmentProvider commitmentProvider() {
        return (userId, from, horizon) -> List.of();
    }

    @Bean
    @ConditionalOnMissingBean(PersonalSignalsProvider.class)
    public PersonalSignalsProvider personalSignalsProvider() {
        return userId -> PersonalSignals.empty();
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleLinker.class)
    public ScheduleLinker scheduleLinker(EventPublisher publisher) {
        return new EventBusScheduleLinker(publisher);
    }
}
