package com.dailycode.domain.delivery.service;

import com.dailycode.domain.delivery.model.OutboundMessage;

/**
 * Outbound e-mail transport.
 */
public interface MessageSender {

    /**
     * @throws com.dailycode.domain.delivery.exception.SendException if the transport rejected the message
     */
    void send(OutboundMessage message);

    /**
     * Verifies the transport is configured and reachable without sending anything.
     */
    boolean isReachable();

    String transportName();
}
