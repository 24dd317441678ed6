package com.company.uptime.service;

import com.company.uptime.event.ThresholdCrossedEvent;

public interface AlertSender {
    void send(ThresholdCrossedEvent event);
}
