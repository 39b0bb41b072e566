package com.ipintel.gateway;

import com.ipintel.config.ConfigurationException;
import com.ipintel.config.GatewayConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates gateway instances from configuration using reflection.
 * Keeps the pipeline agnostic to concrete service implementations.
 */
@Slf4j
public final class GatewayFactory {

    private GatewayFactory() {
        // utility class
    }

    public static LookupGateway createLookup(GatewayConfig config) {
        LookupGateway gateway = instantiate(config, LookupGateway.class);
        gateway.init(config);
        log.info("Created lookup gateway '{}' from class {}", config.getName(), config.getClassName());
        return gateway;
    }

    public static AssessmentGateway createAssessment(GatewayConfig config) {
        AssessmentGateway gateway = instantiate(config, AssessmentGateway.class);
        gateway.init(config);
        log.info("Created assessment gateway '{}' from class {}", config.getName(), config.getClassName());
        return gateway;
    }

    private static <T> T instantiate(GatewayConfig config, Class<T> type) {
        try {
            Class<?> clazz = Class.forName(config.getClassName());
            if (!type.isAssignableFrom(clazz)) {
                throw new ConfigurationException(
                        "Class " + config.getClassName() + " does not implement " + type.getSimpleName());
            }
            return type.cast(clazz.getDeclaredConstructor().newInstance());
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationException("Failed to create gateway: " + config.getName(), e);
        }
    }
}
