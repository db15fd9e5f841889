package com.perpradar.migration;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Legacy flat-file import. Disabled unless {@code legacy-csv-dir} is set.
 */
@ConfigurationProperties(prefix = "perpradar.migration")
@NoArgsConstructor
@Getter
@Setter
public class MigrationProperties {

    /** Directory holding subscribers.csv, wallets.csv and snapshots.csv. */
    private String legacyCsvDir = "";

    /** Zone of the naive timestamps written by the legacy files. */
    private String timeZone = "Asia/Seoul";
}
