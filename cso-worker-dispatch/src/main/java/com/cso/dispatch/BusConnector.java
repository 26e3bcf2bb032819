package com.cso.dispatch;

import com.cso.config.CsoConfig;
import com.cso.logstream.BusException;
import com.cso.logstream.EventBusClient;
import com.cso.logstream.NatsEventBusClient;

/** Opens the event bus connection for one dispatch run. */
@FunctionalInterface
public interface BusConnector {

    EventBusClient connect(CsoConfig config) throws BusException;

    static BusConnector nats() {
        return NatsEventBusClient::connect;
    }
}
