package com.pulse.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.util.RawValue;
import com.pulse.constants.HubProtocol;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Hub ile izleyiciler arasında taşınan JSON zarflarını üretir ve çözer.
 * Veri yükleri bir kez serileştirilir; zarfa yeniden ayrıştırılmadan ham
 * JSON olarak gömülür.
 */
@Singleton
public class HubMessageCodec
{
    private final ObjectMapper mapper;

    @Inject
    public HubMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encodePayload(Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize payload of type "
                    + (payload == null ? "null" : payload.getClass().getName()), e);
        }
    }

    public String data(Topic topic, MessageKind kind, String payloadJson, long timestamp) {
        ObjectNode node = mapper.createObjectNode();
        node.put(HubProtocol.TOPIC, topic.wireName());
        node.put(HubProtocol.TYPE, kind.wireName());
        node.putRawValue(HubProtocol.DATA, new RawValue(payloadJson));
        node.put(HubProtocol.TIMESTAMP, timestamp);
        return write(node);
    }

    public String connected(long timestamp) {
        return control(HubProtocol.CONNECTED, timestamp);
    }

    public String pong(long timestamp) {
        return control(HubProtocol.PONG, timestamp);
    }

    public String subscribed(Collection<Topic> topics, long timestamp) {
        ObjectNode node = mapper.createObjectNode();
        node.put(HubProtocol.TYPE, HubProtocol.SUBSCRIBED);
        ArrayNode array = node.putArray(HubProtocol.TOPICS);
        for (Topic topic : topics) {
            array.add(topic.wireName());
        }
        node.put(HubProtocol.TIMESTAMP, timestamp);
        return write(node);
    }

    /**
     * İstemci mesajını çözer. JSON olmayan, nesne olmayan ya da {@code type}
     * alanı taşımayan mesajlar için boş döner.
     */
    public Optional<ClientMessage> decode(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode type = root.get(HubProtocol.TYPE);
        if (type == null || !type.isTextual()) {
            return Optional.empty();
        }
        List<String> topics = new ArrayList<>();
        JsonNode many = root.get(HubProtocol.TOPICS);
        if (many != null && many.isArray()) {
            for (JsonNode item : many) {
                if (item.isTextual()) {
                    topics.add(item.asText());
                }
            }
        } else {
            JsonNode single = root.get(HubProtocol.TOPIC);
            if (single != null && single.isTextual()) {
                topics.add(single.asText());
            }
        }
        return Optional.of(new ClientMessage(type.asText(), topics));
    }

    private String control(String type, long timestamp) {
        ObjectNode node = mapper.createObjectNode();
        node.put(HubProtocol.TYPE, type);
        node.put(HubProtocol.TIMESTAMP, timestamp);
        return write(node);
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize hub message", e);
        }
    }
}
