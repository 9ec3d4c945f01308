package com.pulse.hub;

/**
 * Yayın mesajının türü: yoklamayla üretilen tam görüntü ya da akıştan gelen
 * tek bir kayıt.
 */
public enum MessageKind
{
    SNAPSHOT("snapshot"),
    UPDATE("update");

    private final String wireName;

    MessageKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
