package com.williamcallahan.chatrelay.domain.session;

import java.util.List;

/**
 * Result of one inactivity scan: sessions that crossed the warning threshold and sessions that timed out.
 * The corresponding flags were already set on the stored sessions when the scan was taken.
 *
 * @param toWarn user ids that should receive the inactivity warning
 * @param toClose user ids whose session should be closed
 */
public record InactivityScan(List<String> toWarn, List<String> toClose) {

    public InactivityScan {
        toWarn = List.copyOf(toWarn);
        toClose = List.copyOf(toClose);
    }

    public boolean isEmpty() {
        return toWarn.isEmpty() && toClose.isEmpty();
    }
}
