/**
 * Main application class for the home network dashboard back end
 *
 * Features:
 * - Hosts the reverse-proxy registry API under /api/reverseproxy
 * - Compiles the registry into proxy configuration and pushes it to the admin API
 * - Entry point for Spring Boot application
 */

package net.homeroute;

import net.homeroute.config.ReverseProxyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HomeRouteApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(HomeRouteApplication.class);

    private final ReverseProxyProperties properties;

    public HomeRouteApplication(ReverseProxyProperties properties) {
        this.properties = properties;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(HomeRouteApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Reverse-proxy registry at {}, admin API at {}, dashboard port {}",
            properties.getRegistryFile(), properties.getAdminUrl(), properties.getDashboardPort());
        if (!properties.hasCloudflareApiToken()) {
            log.info("CF_API_TOKEN not set; certificates will be issued per host");
        }
    }
}
