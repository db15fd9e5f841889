package com.perpradar.registry;

import com.perpradar.config.MongoConfig;
import com.perpradar.snapshot.SnapshotStore;
import com.perpradar.subscription.SubscriberStore;
import com.perpradar.subscription.SubscriptionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Clock;
import java.time.Instant;

import static com.perpradar.registry.WalletRegistryTest.addr;
import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest(properties = {
        "spring.data.mongodb.auto-index-creation=true",
        "perpradar.registry.max-wallets-per-subscriber=5"
})
@Testcontainers
@Import({
        MongoConfig.class,
        RegistryConfig.class,
        SnapshotStore.class,
        WalletRegistry.class,
        SubscriberStore.class,
        SubscriptionService.class,
        WalletRegistryIntegrationTest.ClockTestConfig.class
})
class WalletRegistryIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @TestConfiguration
    static class ClockTestConfig {
        @Bean
        Clock clock() {
            return new TickingClock(Instant.parse("2025-01-01T00:00:00Z"));
        }
    }

    @Autowired
    WalletRegistry registry;
    @Autowired
    SubscriptionService subscriptionService;
    @Autowired
    SnapshotStore snapshotStore;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void clean() {
        mongoTemplate.dropCollection("subscribers");
        mongoTemplate.dropCollection("wallet_links");
        mongoTemplate.dropCollection("wallet_snapshots");
    }

    @Test
    @DisplayName("sixth wallet evicts the oldest; refcounts follow the active links")
    void capAndEviction() {
        subscriptionService.subscribe(1L, "alice");
        for (int i = 1; i <= 5; i++) {
            assertThat(registry.addWallet(1L, addr(i)).added()).isTrue();
        }

        AddWalletResult sixth = registry.addWallet(1L, addr(6));

        assertThat(sixth.evictedAddress()).contains(addr(1));
        assertThat(registry.listWallets(1L))
                .extracting(LinkedWallet::address)
                .containsExactly(addr(2), addr(3), addr(4), addr(5), addr(6));
        assertThat(snapshotStore.followersOf(addr(1))).isZero();
        assertThat(snapshotStore.followersOf(addr(6))).isEqualTo(1);
        assertThat(registry.listMonitoredAddresses()).containsExactly(addr(2), addr(3), addr(4), addr(5), addr(6));
    }

    @Test
    @DisplayName("shared wallet is counted once per subscriber and monitored until the last follower leaves")
    void sharedWallet() {
        subscriptionService.subscribe(1L, "alice");
        subscriptionService.subscribe(2L, "bob");
        registry.addWallet(1L, addr(7));
        registry.addWallet(2L, addr(7));

        assertThat(snapshotStore.followersOf(addr(7))).isEqualTo(2);
        assertThat(registry.listActiveFollowers(addr(7))).containsExactly(1L, 2L);

        assertThat(registry.removeWallet(1L, addr(7))).isTrue();
        assertThat(snapshotStore.followersOf(addr(7))).isEqualTo(1);
        assertThat(registry.listActiveFollowers(addr(7))).containsExactly(2L);

        assertThat(registry.removeWallet(2L, addr(7))).isTrue();
        assertThat(registry.listMonitoredAddresses()).isEmpty();
    }

    @Test
    @DisplayName("unsubscribe keeps links but stops monitoring; re-subscribe restores counts")
    void unsubscribeAndResubscribe() {
        subscriptionService.subscribe(1L, "alice");
        registry.addWallet(1L, addr(1));
        registry.addWallet(1L, addr(2));
        registry.addWallet(1L, addr(3));

        subscriptionService.unsubscribe(1L);

        assertThat(registry.listWallets(1L)).hasSize(3);
        assertThat(registry.listMonitoredAddresses()).isEmpty();
        assertThat(registry.listActiveFollowers(addr(1))).isEmpty();

        subscriptionService.subscribe(1L, "alice");

        for (int i = 1; i <= 3; i++) {
            assertThat(snapshotStore.followersOf(addr(i))).isEqualTo(1);
        }
        assertThat(registry.listActiveFollowers(addr(2))).containsExactly(1L);
    }

    @Test
    @DisplayName("wallet added while unsubscribed is counted on re-subscribe only")
    void addWhileUnsubscribed() {
        subscriptionService.subscribe(1L, "alice");
        subscriptionService.unsubscribe(1L);

        registry.addWallet(1L, addr(4));
        assertThat(snapshotStore.followersOf(addr(4))).isZero();

        subscriptionService.subscribe(1L, "alice");
        assertThat(snapshotStore.followersOf(addr(4))).isEqualTo(1);
    }

    @Test
    @DisplayName("rebuild recomputes counts from active subscribers and links")
    void rebuildFollowerCounts() {
        subscriptionService.subscribe(1L, "alice");
        subscriptionService.subscribe(2L, "bob");
        registry.addWallet(1L, addr(1));
        registry.addWallet(2L, addr(1));
        registry.addWallet(2L, addr(2));
        snapshotStore.resetFollowers(addr(1), 9);
        snapshotStore.resetFollowers(addr(3), 4);
        subscriptionService.unsubscribe(2L);

        registry.rebuildFollowerCounts();

        assertThat(snapshotStore.followersOf(addr(1))).isEqualTo(1);
        assertThat(snapshotStore.followersOf(addr(2))).isZero();
        assertThat(snapshotStore.followersOf(addr(3))).isZero();
    }
}
