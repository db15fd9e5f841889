package com.perpradar.migration;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.perpradar.common.EvmAddresses;
import com.perpradar.domain.Position;
import com.perpradar.domain.Subscriber;
import com.perpradar.domain.SubscriberRepository;
import com.perpradar.domain.WalletLink;
import com.perpradar.domain.WalletLinkRepository;
import com.perpradar.registry.WalletRegistry;
import com.perpradar.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * One-shot import of the legacy CSV state (subscribers.csv, wallets.csv, snapshots.csv).
 * Runs on startup only when a directory is configured and the database holds no data yet.
 * Follower counts are recomputed from the imported links, not taken from the files.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LegacyCsvImporter {

    static final String SUBSCRIBERS_FILE = "subscribers.csv";
    static final String WALLETS_FILE = "wallets.csv";
    static final String SNAPSHOTS_FILE = "snapshots.csv";

    private final SubscriberRepository subscriberRepository;
    private final WalletLinkRepository walletLinkRepository;
    private final SnapshotStore snapshotStore;
    private final WalletRegistry walletRegistry;
    private final MigrationProperties properties;
    private final CsvMapper csvMapper = new CsvMapper();

    @EventListener(ApplicationReadyEvent.class)
    @Order(0)
    public void onApplicationReady() {
        String dir = properties.getLegacyCsvDir();
        if (dir == null || dir.isBlank()) {
            return;
        }
        try {
            importFrom(Path.of(dir));
        } catch (RuntimeException e) {
            log.error("Legacy CSV import from {} failed", dir, e);
        }
    }

    public ImportReport importFrom(Path dir) {
        if (!isDatabaseEmpty()) {
            log.info("Database already populated; legacy CSV import skipped");
            return ImportReport.skipped();
        }
        ZoneId zone = ZoneId.of(properties.getTimeZone());
        int subscribers = importSubscribers(dir.resolve(SUBSCRIBERS_FILE), zone);
        int links = importWallets(dir.resolve(WALLETS_FILE), zone);
        int snapshots = importSnapshots(dir.resolve(SNAPSHOTS_FILE), zone);
        walletRegistry.rebuildFollowerCounts();
        ImportReport report = new ImportReport(subscribers, links, snapshots);
        log.info("Legacy CSV import from {} done: {}", dir, report);
        return report;
    }

    private boolean isDatabaseEmpty() {
        return subscriberRepository.count() == 0
                && walletLinkRepository.count() == 0
                && snapshotStore.findAllAddresses().isEmpty();
    }

    /** Rows are appended per subscribe; a subscriber is active if any of its rows is. */
    private int importSubscribers(Path file, ZoneId zone) {
        Map<Long, Subscriber> byId = new LinkedHashMap<>();
        for (Map<String, String> row : readRows(file)) {
            Long id = parseLong(row.get("user_id"));
            if (id == null) {
                log.warn("Skipping subscriber row without user_id: {}", row);
                continue;
            }
            Instant subscribedAt = parseTimestamp(row.get("subscribed_at"), zone);
            boolean active = "true".equalsIgnoreCase(trim(row.get("active")));
            Subscriber s = byId.computeIfAbsent(id, k -> {
                Subscriber created = new Subscriber();
                created.setId(k);
                created.setDisplayName("");
                created.setSubscribedAt(subscribedAt);
                return created;
            });
            String name = trim(row.get("username"));
            if (!name.isEmpty()) {
                s.setDisplayName(name);
            }
            if (subscribedAt != null && (s.getSubscribedAt() == null || subscribedAt.isBefore(s.getSubscribedAt()))) {
                s.setSubscribedAt(subscribedAt);
            }
            s.setActive(s.isActive() || active);
        }
        subscriberRepository.saveAll(byId.values());
        return byId.size();
    }

    private int importWallets(Path file, ZoneId zone) {
        List<WalletLink> links = new ArrayList<>();
        for (Map<String, String> row : readRows(file)) {
            Long subscriberId = parseLong(row.get("user_id"));
            String address = EvmAddresses.normalize(row.get("address"));
            if (subscriberId == null || !EvmAddresses.isValid(address)) {
                log.warn("Skipping malformed wallet row: {}", row);
                continue;
            }
            WalletLink link = new WalletLink();
            link.setSubscriberId(subscriberId);
            link.setAddress(address);
            link.setAddedAt(parseTimestamp(row.get("added_at"), zone));
            link.setActive("true".equalsIgnoreCase(trim(row.get("active"))));
            links.add(link);
        }
        walletLinkRepository.saveAll(links);
        return links.size();
    }

    /**
     * Accepts the per-user layout (timestamp,user_id,address,token,amount) and both per-wallet layouts
     * (address,followers_count,timestamp,token,amount[,usd_value]). Keeps the rows of the latest timestamp per address.
     */
    private int importSnapshots(Path file, ZoneId zone) {
        Map<String, LatestSnapshot> latest = new HashMap<>();
        for (Map<String, String> row : readRows(file)) {
            String address = EvmAddresses.normalize(row.get("address"));
            String token = trim(row.get("token")).toUpperCase(Locale.ROOT);
            Instant timestamp = parseTimestamp(row.get("timestamp"), zone);
            BigDecimal size = parseDecimal(row.get("amount"));
            if (!EvmAddresses.isValid(address) || token.isEmpty() || timestamp == null || size == null) {
                log.warn("Skipping malformed snapshot row: {}", row);
                continue;
            }
            BigDecimal usd = parseDecimal(row.get("usd_value"));
            LatestSnapshot snapshot = latest.get(address);
            if (snapshot == null || timestamp.isAfter(snapshot.timestamp)) {
                snapshot = new LatestSnapshot(timestamp);
                latest.put(address, snapshot);
            } else if (timestamp.isBefore(snapshot.timestamp)) {
                continue;
            }
            snapshot.positions.put(token, new Position(size, usd));
        }
        latest.forEach((address, s) -> snapshotStore.save(address, s.positions, s.timestamp));
        return latest.size();
    }

    private List<Map<String, String>> readRows(Path file) {
        if (!Files.isRegularFile(file)) {
            log.info("Legacy file {} not found; skipped", file);
            return List.of();
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(file.toFile())) {
            return it.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    static Instant parseTimestamp(String value, ZoneId zone) {
        String v = trim(value);
        if (v.isEmpty()) {
            return null;
        }
        try {
            return LocalDateTime.parse(v).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(v).toInstant();
            } catch (DateTimeParseException e2) {
                return null;
            }
        }
    }

    private static BigDecimal parseDecimal(String value) {
        String v = trim(value);
        if (v.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long parseLong(String value) {
        String v = trim(value);
        if (v.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    private static final class LatestSnapshot {
        private final Instant timestamp;
        private final Map<String, Position> positions = new TreeMap<>();

        private LatestSnapshot(Instant timestamp) {
            this.timestamp = timestamp;
        }
    }
}
