package com.pulse.constants;

public interface HubProtocol
{
    // Envelope field names.
    String TYPE = "type";
    String TOPIC = "topic";
    String TOPICS = "topics";
    String DATA = "data";
    String TIMESTAMP = "timestamp";

    // Client to server message types.
    String SUBSCRIBE = "subscribe";
    String UNSUBSCRIBE = "unsubscribe";
    String PING = "ping";

    // Server to client control messages.
    String CONNECTED = "connected";
    String SUBSCRIBED = "subscribed";
    String PONG = "pong";

    // Wildcard subscription that matches every topic.
    String WILDCARD = "*";
}
