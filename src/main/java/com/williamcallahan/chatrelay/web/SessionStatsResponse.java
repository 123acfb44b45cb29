package com.williamcallahan.chatrelay.web;

/**
 * Operational counters read from the session store.
 *
 * @param activeSessions sessions currently held in memory
 * @param totalMessages counted messages across those sessions
 * @param sweeperRunning whether the expiration sweeper is scheduled
 */
public record SessionStatsResponse(int activeSessions, long totalMessages, boolean sweeperRunning) {}
