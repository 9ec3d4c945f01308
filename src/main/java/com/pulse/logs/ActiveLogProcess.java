package com.pulse.logs;

/**
 * Tampondaki kayıtlara göre log üreten bir sürecin özeti.
 */
public record ActiveLogProcess(String name, int count, String lastSeen) {}
