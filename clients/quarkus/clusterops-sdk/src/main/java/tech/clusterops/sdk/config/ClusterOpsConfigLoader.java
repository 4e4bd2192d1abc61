package tech.clusterops.sdk.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

import java.util.Map;

/**
 * Builds {@link ClusterOpsConfig} outside a CDI container.
 *
 * <p>Sources, highest priority first: the given overrides, system properties, environment
 * variables ({@code CLUSTEROPS_AUTH_API_TOKEN} etc.), {@code META-INF/microprofile-config.properties}.
 * Property expressions such as {@code ${user.home}} are expanded.
 */
public final class ClusterOpsConfigLoader {

    private static final int OVERRIDE_ORDINAL = 500;

    private ClusterOpsConfigLoader() {}

    public static ClusterOpsConfig load() {
        return load(Map.of());
    }

    public static ClusterOpsConfig load(Map<String, String> overrides) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
            .addDefaultSources()
            .addDefaultInterceptors()
            .withSources(new PropertiesConfigSource(overrides, "clusterops-overrides", OVERRIDE_ORDINAL))
            .withMapping(ClusterOpsConfig.class)
            .build();
        return config.getConfigMapping(ClusterOpsConfig.class);
    }
}
