package com.perpradar.monitor;

/**
 * Counters of one monitoring pass.
 */
public record CycleReport(int walletsChecked, int walletsChanged, int walletsFailed, int alertsSent) {
}
