package com.openforge.actionmind.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Activates Spring Data JPA Auditing so that @CreatedDate on BaseEntity is
 * populated by the framework.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
