package com.perpradar.monitor;

import com.perpradar.alert.AlertDispatcher;
import com.perpradar.alert.AlertRenderer;
import com.perpradar.detection.ChangeDetector;
import com.perpradar.detection.PositionChange;
import com.perpradar.domain.Position;
import com.perpradar.exchange.PositionFetcher;
import com.perpradar.registry.WalletRegistry;
import com.perpradar.snapshot.SnapshotStore;
import com.perpradar.snapshot.StoredSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One pass over every monitored wallet: fetch, compare with the stored snapshot, persist and alert on change.
 * Wallets are processed one at a time; a failure on one wallet is logged and the pass moves on.
 * The stored snapshot only advances when a change is detected, so small drifts accumulate until they cross
 * the threshold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonitoringCycle {

    private final WalletRegistry walletRegistry;
    private final PositionFetcher positionFetcher;
    private final SnapshotStore snapshotStore;
    private final ChangeDetector changeDetector;
    private final AlertRenderer alertRenderer;
    private final AlertDispatcher alertDispatcher;
    private final MonitorProperties properties;
    private final Clock clock;

    public CycleReport runOnce() {
        Set<String> addresses = walletRegistry.listMonitoredAddresses();
        log.info("Monitoring cycle started for {} wallet(s)", addresses.size());
        int checked = 0;
        int changed = 0;
        int failed = 0;
        int alerts = 0;
        boolean first = true;
        for (String address : addresses) {
            if (!first) {
                pause();
            }
            first = false;
            checked++;
            try {
                int sent = checkWallet(address);
                if (sent >= 0) {
                    changed++;
                    alerts += sent;
                }
            } catch (Exception e) {
                failed++;
                log.warn("Wallet {} skipped this cycle: {}", address, e.getMessage());
            }
        }
        CycleReport report = new CycleReport(checked, changed, failed, alerts);
        log.info("Monitoring cycle finished: {}", report);
        return report;
    }

    /**
     * @return alerts sent, or -1 if nothing changed
     */
    private int checkWallet(String address) {
        Map<String, Position> current = positionFetcher.fetch(address);
        StoredSnapshot previous = snapshotStore.load(address);
        List<PositionChange> changes = changeDetector.detect(previous.positions(), current);
        if (changes.isEmpty()) {
            log.debug("No significant change for {}", address);
            return -1;
        }
        Instant now = Instant.now(clock);
        snapshotStore.save(address, current, now);
        log.info("Detected {} change(s) for {}", changes.size(), address);

        Set<Long> recipients = walletRegistry.listActiveFollowers(address);
        if (recipients.isEmpty()) {
            return 0;
        }
        String message = alertRenderer.render(address, changes, previous.timestamp(), now);
        return alertDispatcher.dispatch(recipients, message);
    }

    /**
     * Delay between two wallets. An interrupt cuts the delay short but not the cycle; the flag is restored
     * for the scheduler to see once the cycle has finished.
     */
    void pause() {
        long delay = properties.getPerWalletDelayMs();
        if (delay <= 0 || Thread.currentThread().isInterrupted()) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            log.debug("Per-wallet delay interrupted; finishing the cycle without delays");
            Thread.currentThread().interrupt();
        }
    }
}
