package com.pulse.api;

import com.pulse.logs.ActiveLogProcess;
import com.pulse.logs.LogEntry;
import com.pulse.logs.LogQueryException;
import com.pulse.logs.LogQueryService;
import com.pulse.logs.LogSource;
import com.pulse.logs.LogStreamService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Push aboneliği kullanmayan istemcilerin log akışını çekerek okuduğu REST
 * kaynağı. {@code recent} ve {@code active-processes} çağrıları boşta kalma
 * kapısını yeniler; istek gelmeyi bıraktıktan bir süre sonra, başka talep
 * yoksa log takipçisi durur. {@code query} uçları canlı akışa dokunmaz,
 * geçmiş kayıtları tek seferlik komutla okur.
 */
@Path("/api/logs")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class LogsResource {

    private static final Logger LOG = Logger.getLogger(LogsResource.class);

    private final LogStreamService logs;
    private final LogQueryService queries;

    @Inject
    public LogsResource(LogStreamService logs, LogQueryService queries) {
        this.logs = logs;
        this.queries = queries;
    }

    @GET
    @Path("recent")
    public RecentLogs recent(@QueryParam("count") Integer count, @QueryParam("process") String process) {
        logs.touch();
        List<LogEntry> entries = logs.recent(count, process);
        return new RecentLogs(entries, entries.size());
    }

    @GET
    @Path("active-processes")
    public ActiveProcesses activeProcesses() {
        logs.touch();
        return new ActiveProcesses(logs.activeProcesses());
    }

    @GET
    @Path("query")
    public Response query(@QueryParam("minutes") @DefaultValue("5") int minutes,
                          @QueryParam("predicate") String predicate) {
        if (minutes <= 0) {
            return badRequest("minutes must be positive");
        }
        try {
            return ok(queries.query(minutes, predicate));
        } catch (LogQueryException e) {
            return unavailable(e);
        }
    }

    @GET
    @Path("query/process/{name}")
    public Response queryByProcess(@PathParam("name") String name,
                                   @QueryParam("minutes") @DefaultValue("5") int minutes) {
        if (minutes <= 0) {
            return badRequest("minutes must be positive");
        }
        try {
            return ok(queries.queryByProcess(name, minutes));
        } catch (LogQueryException e) {
            return unavailable(e);
        }
    }

    @GET
    @Path("sources")
    public LogSources sources() {
        return new LogSources(queries.sources());
    }

    private static Response ok(List<LogEntry> entries) {
        return Response.ok(new RecentLogs(entries, entries.size())).build();
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(new ErrorResponse(message))
                .build();
    }

    private static Response unavailable(LogQueryException e) {
        LOG.warnf(e, "Log query failed");
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(new ErrorResponse("Log query failed"))
                .build();
    }

    public record RecentLogs(List<LogEntry> logs, int count) {}

    public record ActiveProcesses(List<ActiveLogProcess> processes) {}

    public record LogSources(List<LogSource> sources) {}

    public record ErrorResponse(String message) {}
}
