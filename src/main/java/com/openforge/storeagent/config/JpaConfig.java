package com.openforge.storeagent.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Activates Spring Data JPA Auditing so that @CreatedDate / @LastModifiedDate
 * on BaseEntity are populated by the framework.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
