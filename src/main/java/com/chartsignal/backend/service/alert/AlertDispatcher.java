package com.chartsignal.backend.service.alert;

import com.chartsignal.backend.model.AlertNotification;

/**
 * Delivery channel for alerts. Implementations render the payload for their platform.
 */
public interface AlertDispatcher {

    String getChannel();

    void dispatch(AlertNotification notification);
}
