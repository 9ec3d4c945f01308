package com.pulse.provider;

import com.pulse.poll.ProviderException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SystemStatsProviderTest {

    @Test
    void statsAreWithinSaneBounds() throws ProviderException {
        SystemStats stats = new SystemStatsProvider().fetch();

        assertTrue(stats.cpu().cores() >= 1);
        assertTrue(stats.cpu().usedPercent() >= 0.0 && stats.cpu().usedPercent() <= 100.0);
        assertTrue(stats.memory().total() > 0);
        assertEquals(stats.memory().total(), stats.memory().used() + stats.memory().free());
        assertTrue(stats.disk().total() > 0);
        assertEquals("/", stats.disk().mountPoint());
        assertTrue(stats.processCount() > 0);
        assertNotNull(stats.hostname());
    }

    @Test
    void unreadableMountPointFails() {
        SystemStatsProvider provider = new SystemStatsProvider(Path.of("/nonexistent/pulse-mount"));
        assertThrows(ProviderException.class, provider::fetch);
    }
}
