package dev.campusreports.config;

import dev.campusreports.util.SnowflakeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Node ID comes from {@code app.snowflake.node-id} (env SNOWFLAKE_NODE_ID) and falls back
 * to a hash of the host name.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SnowflakeIdConfig {

    @Value("${app.snowflake.node-id:#{null}}")
    private Long configuredNodeId;

    @Bean
    public SnowflakeId snowflakeId() {
        long nodeId = resolveNodeId();
        log.info("Initialized Snowflake ID generator with node ID: {}", nodeId);
        return new SnowflakeId(nodeId);
    }

    private long resolveNodeId() {
        if (configuredNodeId != null) {
            return configuredNodeId;
        }
        try {
            String hostname = InetAddress.getLocalHost().getHostName();
            long nodeId = (hostname.hashCode() & 0x7fffffff) & 0x3FF;
            log.debug("Derived Snowflake node ID from hostname '{}': {}", hostname, nodeId);
            return nodeId;
        } catch (UnknownHostException e) {
            log.warn("Failed to resolve hostname, using node ID 0: {}", e.getMessage());
            return 0;
        }
    }
}
