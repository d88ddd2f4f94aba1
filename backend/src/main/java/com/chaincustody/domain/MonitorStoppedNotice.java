package com.chaincustody.domain;

/**
 * Payload of the monitor.stopped event raised when a deposit monitor fail-stops.
 */
public record MonitorStoppedNotice(String walletId, String chain, String address, int consecutiveErrors, String lastError) {
}
