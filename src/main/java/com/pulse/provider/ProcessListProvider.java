package com.pulse.provider;

import com.pulse.config.HubProperties;
import com.pulse.poll.DataProvider;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link ProcessHandle} ile süreçleri listeler, toplam CPU süresine göre azalan
 * sırada dizer ve yapılandırılan sayıyla sınırlar.
 */
@Singleton
public class ProcessListProvider implements DataProvider<List<ProcessInfo>>
{
    private final int limit;
    private final Supplier<Stream<ProcessHandle>> processes;

    @Inject
    public ProcessListProvider(HubProperties properties) {
        this(properties.poll().processLimit(), ProcessHandle::allProcesses);
    }

    public ProcessListProvider(int limit, Supplier<Stream<ProcessHandle>> processes) {
        this.limit = Math.max(1, limit);
        this.processes = processes;
    }

    @Override
    public List<ProcessInfo> fetch() {
        try (Stream<ProcessHandle> all = processes.get()) {
            return all.map(ProcessListProvider::describe)
                    .sorted(Comparator.comparingLong(ProcessInfo::cpuMillis).reversed()
                            .thenComparingLong(ProcessInfo::pid))
                    .limit(limit)
                    .collect(Collectors.toList());
        }
    }

    static ProcessInfo describe(ProcessHandle handle) {
        ProcessHandle.Info info = handle.info();
        String command = info.command().orElse("?");
        int slash = command.lastIndexOf('/');
        String name = slash >= 0 ? command.substring(slash + 1) : command;
        String args = info.arguments()
                .map(a -> String.join(" ", a))
                .orElse("");
        return new ProcessInfo(
                handle.pid(),
                handle.parent().map(ProcessHandle::pid).orElse(null),
                info.user().orElse(null),
                name,
                command,
                args,
                info.startInstant().map(Object::toString).orElse(null),
                info.totalCpuDuration().map(Duration::toMillis).orElse(0L));
    }
}
