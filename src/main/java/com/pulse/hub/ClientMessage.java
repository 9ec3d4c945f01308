package com.pulse.hub;

import java.util.List;

/**
 * İstemciden gelen, çözümlenmiş kontrol mesajı.
 */
public record ClientMessage(String type, List<String> topics) {

    public ClientMessage {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
