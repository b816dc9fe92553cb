package com.chartsignal.backend.service.alert;

import com.chartsignal.backend.model.AlertNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAlertDispatcher implements AlertDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(LoggingAlertDispatcher.class);

    @Override
    public String getChannel() {
        return "log";
    }

    @Override
    public void dispatch(AlertNotification notification) {
        switch (notification.getSeverity()) {
            case CRITICAL:
            case WARNING:
                logger.warn("[ALERT {}] {} - {} {}", notification.getSeverity(), notification.getTitle(),
                        notification.getBody(), notification.getMetadata());
                break;
            default:
                logger.info("[ALERT {}] {} - {} {}", notification.getSeverity(), notification.getTitle(),
                        notification.getBody(), notification.getMetadata());
        }
    }
}
