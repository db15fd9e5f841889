package com.perpradar.subscription;

import com.perpradar.domain.SubscribeOutcome;
import com.perpradar.domain.Subscriber;
import com.perpradar.domain.SubscriberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Active/inactive registry of notification recipients. Records are never deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriberStore {

    private final SubscriberRepository repository;
    private final Clock clock;

    public SubscribeOutcome subscribe(long id, String displayName) {
        Optional<Subscriber> existing = repository.findById(id);
        if (existing.isEmpty()) {
            Subscriber subscriber = new Subscriber();
            subscriber.setId(id);
            subscriber.setDisplayName(displayName != null ? displayName : "");
            subscriber.setSubscribedAt(Instant.now(clock));
            subscriber.setActive(true);
            repository.save(subscriber);
            log.info("Added subscriber {} ({})", id, displayName);
            return SubscribeOutcome.NEWLY_SUBSCRIBED;
        }
        Subscriber subscriber = existing.get();
        if (subscriber.isActive()) {
            return SubscribeOutcome.ALREADY_ACTIVE;
        }
        subscriber.setActive(true);
        if (displayName != null && !displayName.isBlank()) {
            subscriber.setDisplayName(displayName);
        }
        repository.save(subscriber);
        log.info("Reactivated subscriber {}", id);
        return SubscribeOutcome.REACTIVATED;
    }

    /**
     * @return false if the subscriber is unknown or already inactive
     */
    public boolean unsubscribe(long id) {
        Optional<Subscriber> existing = repository.findById(id);
        if (existing.isEmpty() || !existing.get().isActive()) {
            return false;
        }
        Subscriber subscriber = existing.get();
        subscriber.setActive(false);
        repository.save(subscriber);
        log.info("Deactivated subscriber {}", id);
        return true;
    }

    public boolean isActive(long id) {
        return repository.findById(id).map(Subscriber::isActive).orElse(false);
    }

    public List<Long> findActiveIds() {
        return repository.findByActiveTrue().stream()
                .map(Subscriber::getId)
                .sorted()
                .toList();
    }
}
