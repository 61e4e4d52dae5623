package com.relay.config;

import com.relay.registry.RegistrationConflictPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class RelayConfig {

	/**
	 * Fixed resolution taken from {@code relay.on-conflict}.
	 */
	@Bean
	public RegistrationConflictPolicy registrationConflictPolicy(RelayProperties properties) {
		log.info("Registration conflicts resolved with: {}", properties.getOnConflict());
		return RegistrationConflictPolicy.always(properties.getOnConflict());
	}

}
