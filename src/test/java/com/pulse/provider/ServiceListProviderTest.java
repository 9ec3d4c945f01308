package com.pulse.provider;

import com.pulse.poll.ProviderException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServiceListProviderTest {

    @Test
    void parsesServiceTableAndDerivesStatus() {
        List<ServiceInfo> services = ServiceListProvider.parse(
                "PID\tStatus\tLabel\n"
                        + "412\t0\tcom.apple.WindowServer\n"
                        + "-\t0\tcom.example.idle\n"
                        + "-\t78\tcom.example.crashed\n"
                        + "broken-line\n");

        assertEquals(3, services.size());
        assertEquals(new ServiceInfo("com.apple.WindowServer", 412, 0, "running"), services.get(0));
        assertEquals(new ServiceInfo("com.example.crashed", null, 78, "error"), services.get(1));
        assertEquals(new ServiceInfo("com.example.idle", null, 0, "stopped"), services.get(2));
    }

    @Test
    void headerOnlyOutputIsEmpty() {
        assertTrue(ServiceListProvider.parse("PID\tStatus\tLabel\n").isEmpty());
        assertTrue(ServiceListProvider.parse("").isEmpty());
    }

    @Test
    void fetchRunsConfiguredCommand() throws ProviderException {
        ServiceListProvider provider = new ServiceListProvider(
                List.of("sh", "-c", "printf 'PID\\tStatus\\tLabel\\n7\\t0\\tcom.example.web\\n'"));

        assertEquals(List.of(new ServiceInfo("com.example.web", 7, 0, "running")), provider.fetch());
    }

    // Komut hata koduyla biterse sağlayıcı hatası fırlatılır.
    @Test
    void failingCommandRaisesProviderException() {
        ServiceListProvider failing = new ServiceListProvider(List.of("sh", "-c", "exit 3"));
        ProviderException e = assertThrows(ProviderException.class, failing::fetch);
        assertTrue(e.getMessage().contains("3"));

        ServiceListProvider missing = new ServiceListProvider(List.of("/nonexistent/launchctl"));
        assertThrows(ProviderException.class, missing::fetch);
    }
}
