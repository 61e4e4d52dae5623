package com.relay;

import com.relay.config.RelayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // periodic relay stats
@EnableConfigurationProperties(RelayProperties.class)
public class RelayServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(RelayServerApplication.class, ServerArguments.parse(args).toSpringArguments());
	}

}
