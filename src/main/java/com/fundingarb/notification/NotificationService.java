package com.fundingarb.notification;

import com.fundingarb.config.RiskConfig;
import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.event.TradeClosedEvent;
import com.fundingarb.event.TradeOpenedEvent;
import com.fundingarb.port.NotificationPort;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Turns alerts and trade lifecycle events into operator messages.
 *
 * <p>Alerts of WARNING and above are sent once per incident key and then suppressed for
 * {@code funding.risk.alert-throttle}; INFO alerts are only logged. Delivery runs on
 * {@code eventExecutor} so a slow notification channel never delays trading.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationPort notificationPort;
    private final RiskConfig riskConfig;
    private final Clock clock;

    private final Map<String, Instant> lastSentByIncident = new ConcurrentHashMap<>();

    public NotificationService(NotificationPort notificationPort, RiskConfig riskConfig, Clock clock) {
        this.notificationPort = notificationPort;
        this.riskConfig = riskConfig;
        this.clock = clock;
    }

    @Async("eventExecutor")
    @EventListener
    public void onAlert(AlertEvent event) {
        handleAlert(event);
    }

    /**
     * @return whether the alert was handed to the notification port
     */
    public boolean handleAlert(AlertEvent event) {
        if (event.getLevel() == AlertLevel.INFO) {
            log.info("Alert [{}]: {}", event.getIncidentKey(), event.getMessage());
            return false;
        }
        if (!claimIncident(event.getIncidentKey())) {
            log.debug("Alert throttled [{}]: {}", event.getIncidentKey(), event.getMessage());
            return false;
        }
        String text = event.getLevel() + ": " + event.getMessage();
        if (notificationPort instanceof TelegramNotifier telegram) {
            telegram.send(text, event.getLevel());
        } else {
            notificationPort.sendMessage(text);
        }
        return true;
    }

    @Async("eventExecutor")
    @EventListener
    public void onTradeOpened(TradeOpenedEvent event) {
        Trade trade = event.getTrade();
        notificationPort.sendMessage(String.format("Opened %s: %s %s on %s / %s on %s, APY %s", trade.getSymbol(),
                trade.getLeg1().getFilledQty(), trade.getLeg1().getSide(), trade.getLeg1().getVenue(),
                trade.getLeg2().getSide(), trade.getLeg2().getVenue(), trade.getEntryApy()));
    }

    @Async("eventExecutor")
    @EventListener
    public void onTradeClosed(TradeClosedEvent event) {
        Trade trade = event.getTrade();
        notificationPort.sendMessage(String.format("Closed %s (%s): realized %s, funding %s, fees %s",
                trade.getSymbol(), event.getReason(), trade.getRealizedPnl(), trade.getFundingCollected(),
                trade.totalFees()));
    }

    private boolean claimIncident(String key) {
        Instant now = clock.instant();
        boolean[] claimed = {false};
        lastSentByIncident.compute(key, (k, last) -> {
            if (last == null || !now.isBefore(last.plus(riskConfig.getAlertThrottle()))) {
                claimed[0] = true;
                return now;
            }
            return last;
        });
        return claimed[0];
    }
}
