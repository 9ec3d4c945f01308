package com.pulse.api;

import com.pulse.hub.ConnectionRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.lang.management.ManagementFactory;

@Path("/api/health")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

    private final ConnectionRegistry registry;

    @Inject
    public HealthResource(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @GET
    public Health health() {
        return new Health("ok",
                ManagementFactory.getRuntimeMXBean().getUptime(),
                registry.connectionCount(),
                System.currentTimeMillis());
    }

    public record Health(String status, long uptimeMillis, int clients, long timestamp) {}
}
