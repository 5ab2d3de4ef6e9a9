package com.drinkjoy.catalog.application;

import java.time.Duration;

/**
 * Lifecycle of the background catalog synchronization
 */
public interface CatalogSyncControl {

    void start();

    void stop();

    boolean isRunning();

    SyncResult performSync();

    /**
     * Runs one sync now, whether or not the timer is armed. Never re-arms it.
     */
    SyncResult performManualSync();

    SchedulerStatus getStatus();

    /**
     * Changes the sync interval, restarting the timer if it is running
     */
    void updateInterval(Duration interval);
}
