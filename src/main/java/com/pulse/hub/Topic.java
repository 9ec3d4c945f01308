package com.pulse.hub;

import com.pulse.constants.HubProtocol;

import java.util.Locale;
import java.util.Optional;

/**
 * İzleyicilerin abone olabildiği sabit veri alanlarıdır. {@link #SYSTEM},
 * {@link #SERVICES} ve {@link #PROCESSES} periyodik olarak yoklanır,
 * {@link #LOGS} ise canlı akıştan beslenir. {@link #ALL} joker aboneliktir.
 */
public enum Topic
{
    SYSTEM("system", true),
    SERVICES("services", true),
    PROCESSES("processes", true),
    LOGS("logs", false),
    ALL(HubProtocol.WILDCARD, false);

    private final String wireName;
    private final boolean pollDriven;

    Topic(String wireName, boolean pollDriven) {
        this.wireName = wireName;
        this.pollDriven = pollDriven;
    }

    public String wireName() {
        return wireName;
    }

    public boolean pollDriven() {
        return pollDriven;
    }

    public static Optional<Topic> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Topic topic : values()) {
            if (topic.wireName.equals(normalized)) {
                return Optional.of(topic);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
