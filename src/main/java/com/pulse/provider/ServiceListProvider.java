package com.pulse.provider;

import com.pulse.config.HubProperties;
import com.pulse.poll.DataProvider;
import com.pulse.poll.ProviderException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Servis listeleme komutunu (varsayılan {@code launchctl list}) çalıştırır ve
 * {@code PID Status Label} sütunlu çıktısını {@link ServiceInfo} listesine
 * çevirir. Komut sıfırdan farklı kodla biterse {@link ProviderException}
 * fırlatılır.
 */
@Singleton
public class ServiceListProvider implements DataProvider<List<ServiceInfo>>
{
    private final List<String> command;

    @Inject
    public ServiceListProvider(HubProperties properties) {
        this(properties.services().command());
    }

    public ServiceListProvider(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Service list command must not be empty");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public List<ServiceInfo> fetch() throws ProviderException {
        String output;
        try {
            Process process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exit = process.waitFor();
            if (exit != 0) {
                throw new ProviderException(String.join(" ", command) + " exited with " + exit);
            }
        } catch (IOException e) {
            throw new ProviderException("Cannot run " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while listing services", e);
        }
        return parse(output);
    }

    /**
     * İlk satırı başlık kabul eder; üç sütundan az olan satırları atlar.
     */
    static List<ServiceInfo> parse(String output) {
        List<ServiceInfo> services = new ArrayList<>();
        String[] lines = output.split("\n");
        for (int i = 1; i < lines.length; i++) {
            String[] parts = lines[i].trim().split("\\s+");
            if (parts.length < 3) {
                continue;
            }
            Integer pid = number(parts[0]);
            Integer exitStatus = number(parts[1]);
            String label = String.join(" ", Arrays.copyOfRange(parts, 2, parts.length));
            services.add(new ServiceInfo(label, pid, exitStatus, status(pid, exitStatus)));
        }
        services.sort(Comparator.comparing(ServiceInfo::label));
        return services;
    }

    private static String status(Integer pid, Integer exitStatus) {
        if (pid != null) return "running";
        if (exitStatus == null || exitStatus == 0) return "stopped";
        return "error";
    }

    private static Integer number(String value) {
        if ("-".equals(value)) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
