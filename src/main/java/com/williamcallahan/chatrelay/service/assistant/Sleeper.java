package com.williamcallahan.chatrelay.service.assistant;

import java.time.Duration;

/**
 * Pause between polls.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
