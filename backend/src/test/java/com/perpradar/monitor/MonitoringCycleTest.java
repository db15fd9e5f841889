package com.perpradar.monitor;

import com.perpradar.alert.AlertDispatcher;
import com.perpradar.alert.AlertProperties;
import com.perpradar.alert.AlertRenderer;
import com.perpradar.detection.ChangeDetector;
import com.perpradar.detection.DetectionProperties;
import com.perpradar.domain.Position;
import com.perpradar.exchange.PositionFetchException;
import com.perpradar.exchange.PositionFetcher;
import com.perpradar.registry.WalletRegistry;
import com.perpradar.snapshot.SnapshotStore;
import com.perpradar.snapshot.StoredSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MonitoringCycleTest {

    private static final String W1 = "0x" + "1".repeat(40);
    private static final String W2 = "0x" + "2".repeat(40);
    private static final String W3 = "0x" + "3".repeat(40);
    private static final Instant NOW = Instant.parse("2025-03-01T10:15:00Z");
    private static final Instant BEFORE = Instant.parse("2025-03-01T08:00:00Z");

    @Mock
    private WalletRegistry walletRegistry;
    @Mock
    private PositionFetcher positionFetcher;
    @Mock
    private SnapshotStore snapshotStore;
    @Mock
    private AlertDispatcher alertDispatcher;

    private MonitoringCycle cycle;

    @BeforeEach
    void setUp() {
        cycle = cycleWithDelay(0);
    }

    private MonitoringCycle cycleWithDelay(long perWalletDelayMs) {
        AlertProperties alertProperties = new AlertProperties();
        alertProperties.setTimeZone("UTC");
        MonitorProperties monitorProperties = new MonitorProperties();
        monitorProperties.setPerWalletDelayMs(perWalletDelayMs);
        return new MonitoringCycle(walletRegistry, positionFetcher, snapshotStore,
                new ChangeDetector(new DetectionProperties()), new AlertRenderer(alertProperties),
                alertDispatcher, monitorProperties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void unchanged(String address) {
        when(positionFetcher.fetch(address)).thenReturn(Map.of());
        when(snapshotStore.load(address)).thenReturn(StoredSnapshot.empty());
    }

    private static Position pos(String size, String usd) {
        return new Position(new BigDecimal(size), new BigDecimal(usd));
    }

    private static Set<String> addresses(String... values) {
        return new TreeSet<>(Set.of(values));
    }

    @Test
    @DisplayName("change: snapshot saved with the current time and alert sent to every active follower")
    void changedWallet_savesAndAlerts() {
        when(walletRegistry.listMonitoredAddresses()).thenReturn(addresses(W1));
        Map<String, Position> current = Map.of("BTC", pos("1.06", "12720"));
        when(positionFetcher.fetch(W1)).thenReturn(current);
        when(snapshotStore.load(W1)).thenReturn(new StoredSnapshot(Map.of("BTC", pos("1.0", "12000")), BEFORE));
        when(walletRegistry.listActiveFollowers(W1)).thenReturn(Set.of(10L, 11L));
        when(alertDispatcher.dispatch(eq(Set.of(10L, 11L)), anyString())).thenReturn(2);

        CycleReport report = cycle.runOnce();

        assertThat(report).isEqualTo(new CycleReport(1, 1, 0, 2));
        verify(snapshotStore).save(W1, current, NOW);
        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(alertDispatcher).dispatch(eq(Set.of(10L, 11L)), message.capture());
        assertThat(message.getValue())
                .contains("Wallet: 0x1111...1111")
                .contains("BTC: 1 → 1.06 (+6.0%)")
                .contains("Since last change: 2h 15m");
    }

    @Test
    @DisplayName("no change: nothing saved and nothing sent")
    void unchangedWallet_noSideEffects() {
        when(walletRegistry.listMonitoredAddresses()).thenReturn(addresses(W1));
        when(positionFetcher.fetch(W1)).thenReturn(Map.of("BTC", pos("1.02", "12240")));
        when(snapshotStore.load(W1)).thenReturn(new StoredSnapshot(Map.of("BTC", pos("1.0", "12000")), BEFORE));

        CycleReport report = cycle.runOnce();

        assertThat(report).isEqualTo(new CycleReport(1, 0, 0, 0));
        verify(snapshotStore, never()).save(anyString(), anyMap(), any());
        verify(alertDispatcher, never()).dispatch(anyCollection(), anyString());
    }

    @Test
    @DisplayName("a failing wallet is skipped and the cycle continues with the rest")
    void fetchFailure_isolated() {
        when(walletRegistry.listMonitoredAddresses()).thenReturn(addresses(W1, W2, W3));
        when(positionFetcher.fetch(W1)).thenReturn(Map.of("ETH", pos("10", "30000")));
        when(positionFetcher.fetch(W2)).thenThrow(new PositionFetchException("HTTP 500", 500, true));
        when(positionFetcher.fetch(W3)).thenReturn(Map.of("SOL", pos("100", "15000")));
        when(snapshotStore.load(W1)).thenReturn(StoredSnapshot.empty());
        when(snapshotStore.load(W3)).thenReturn(StoredSnapshot.empty());
        when(walletRegistry.listActiveFollowers(W1)).thenReturn(Set.of(10L));
        when(walletRegistry.listActiveFollowers(W3)).thenReturn(Set.of(10L));
        when(alertDispatcher.dispatch(eq(Set.of(10L)), anyString())).thenReturn(1);

        CycleReport report = cycle.runOnce();

        assertThat(report).isEqualTo(new CycleReport(3, 2, 1, 2));
        verify(snapshotStore).save(eq(W1), anyMap(), eq(NOW));
        verify(snapshotStore).save(eq(W3), anyMap(), eq(NOW));
        verify(snapshotStore, never()).load(W2);
    }

    @Test
    @DisplayName("first observation alerts as first snapshot")
    void firstSnapshot_rendered() {
        when(walletRegistry.listMonitoredAddresses()).thenReturn(addresses(W1));
        when(positionFetcher.fetch(W1)).thenReturn(Map.of("SOL", pos("100", "15000")));
        when(snapshotStore.load(W1)).thenReturn(StoredSnapshot.empty());
        when(walletRegistry.listActiveFollowers(W1)).thenReturn(Set.of(10L));
        when(alertDispatcher.dispatch(eq(Set.of(10L)), anyString())).thenReturn(1);

        cycle.runOnce();

        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(alertDispatcher).dispatch(eq(Set.of(10L)), message.capture());
        assertThat(message.getValue()).contains("first snapshot").contains("SOL: 0 → 100 (+100.0%)");
    }

    @Test
    @DisplayName("change without active followers still advances the snapshot")
    void noFollowers_savesWithoutDispatch() {
        when(walletRegistry.listMonitoredAddresses()).thenReturn(addresses(W1));
        when(positionFetcher.fetch(W1)).thenReturn(Map.of("SOL", pos("100", "15000")));
        when(snapshotStore.load(W1)).thenReturn(StoredSnapshot.empty());
        when(walletRegistry.listActiveFollowers(W1)).thenReturn(Set.of());

        CycleReport report = cycle.runOnce();

        assertThat(report.walletsChanged()).isEqualTo(1);
        assertThat(report.alertsSent()).isZero();
        verify(snapshotStore).save(eq(W1), anyMap(), eq(NOW));
        verify(alertDispatcher, never()).dispatch(anyCollection(), anyString());
    }

    @Test
    @DisplayName("empty registry: no fetches")
    void noWallets() {
        when(walletRegistry.listMonitoredAddresses()).thenReturn(Set.of());

        assertThat(cycle.runOnce()).isEqualTo(new CycleReport(0, 0, 0, 0));
        verify(positionFetcher, never()).fetch(anyString());
    }

    @Test
    @DisplayName("the per-wallet delay runs between wallets, never before the first")
    void delay_onlyBetweenWallets() {
        MonitoringCycle delayed = spy(cycleWithDelay(1));
        when(walletRegistry.listMonitoredAddresses()).thenReturn(addresses(W1, W2, W3));
        unchanged(W1);
        unchanged(W2);
        unchanged(W3);

        delayed.runOnce();

        InOrder order = inOrder(delayed, positionFetcher);
        order.verify(positionFetcher).fetch(W1);
        order.verify(delayed).pause();
        order.verify(positionFetcher).fetch(W2);
        order.verify(delayed).pause();
        order.verify(positionFetcher).fetch(W3);
        verify(delayed, times(2)).pause();
    }

    @Test
    @DisplayName("single wallet: no delay at all")
    void delay_notForSingleWallet() {
        MonitoringCycle delayed = spy(cycleWithDelay(1));
        when(walletRegistry.listMonitoredAddresses()).thenReturn(addresses(W1));
        unchanged(W1);

        delayed.runOnce();

        verify(delayed, never()).pause();
    }

    @Test
    @DisplayName("an interrupt during the delay does not end the cycle early")
    void interrupt_cycleStillCompletes() {
        MonitoringCycle delayed = cycleWithDelay(60_000);
        when(walletRegistry.listMonitoredAddresses()).thenReturn(addresses(W1, W2, W3));
        unchanged(W1);
        unchanged(W2);
        unchanged(W3);

        Thread.currentThread().interrupt();
        try {
            CycleReport report = delayed.runOnce();

            assertThat(report.walletsChecked()).isEqualTo(3);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        verify(positionFetcher).fetch(W3);
    }
}
