package com.toolgate.core.policy;

import com.toolgate.core.config.ToolgateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Provides the {@link PermissionConfigStore} backing {@link PermissionPolicy}.
 * The TOML file store is used unless another store bean is defined.
 */
@Configuration
public class PolicyConfig {

    private static final Logger log = LoggerFactory.getLogger(PolicyConfig.class);

    @Bean
    @ConditionalOnMissingBean(PermissionConfigStore.class)
    public PermissionConfigStore tomlPermissionConfigStore(ToolgateProperties properties) {
        Path file = Path.of(properties.getPolicy().getFile());
        log.info("Using tool policy file {}", file.toAbsolutePath());
        return new TomlPermissionConfigStore(file);
    }
}
