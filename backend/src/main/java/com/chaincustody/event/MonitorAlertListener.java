package com.chaincustody.event;

import com.chaincustody.domain.ChainEvent;
import com.chaincustody.domain.MonitorStoppedNotice;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs fail-stopped monitors at ERROR so that log-based alerting picks them up.
 */
@Component
@Slf4j
public class MonitorAlertListener {

    @EventListener(condition = "#event.topic() == 'monitor.stopped'")
    public void onMonitorStopped(ChainEvent event) {
        if (event.payload() instanceof MonitorStoppedNotice notice) {
            log.error("Deposit monitor stopped: chain={} address={} wallet={} after {} consecutive errors, last: {}",
                    notice.chain(), notice.address(), notice.walletId(), notice.consecutiveErrors(), notice.lastError());
        }
    }
}
