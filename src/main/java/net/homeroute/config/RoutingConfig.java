package net.homeroute.config;

import net.homeroute.adapters.persistence.RegistryFileRepository;
import net.homeroute.domain.routing.RouteCompiler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;

import java.nio.file.Path;

/**
 * Wires the framework-free routing and persistence pieces from {@link ReverseProxyProperties}.
 */
@Configuration
public class RoutingConfig {

    @Bean
    public RouteCompiler routeCompiler(ReverseProxyProperties properties) {
        return new RouteCompiler(properties.getDashboardPort(), properties.getForwardAuthPath());
    }

    @Bean
    public RegistryFileRepository registryFileRepository(ReverseProxyProperties properties, ObjectMapper objectMapper) {
        return new RegistryFileRepository(Path.of(properties.getRegistryFile()), objectMapper);
    }
}
