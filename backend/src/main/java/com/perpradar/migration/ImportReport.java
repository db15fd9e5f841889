package com.perpradar.migration;

public record ImportReport(int subscribers, int walletLinks, int snapshots) {

    public static ImportReport skipped() {
        return new ImportReport(0, 0, 0);
    }
}
