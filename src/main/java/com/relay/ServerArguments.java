package com.relay;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional command line: {@code [host] [port]}.
 * <p>
 * Spring style {@code --key=value} options are passed through untouched, so the usual
 * Spring Boot overrides keep working next to the two positional values.
 */
@Getter
public class ServerArguments {

	private final String host;
	private final Integer port;
	private final List<String> options;

	private ServerArguments(String host, Integer port, List<String> options) {
		this.host = host;
		this.port = port;
		this.options = options;
	}

	public static ServerArguments parse(String[] args) {
		List<String> positional = new ArrayList<>();
		List<String> options = new ArrayList<>();
		for (String arg : args) {
			if (arg.startsWith("--")) {
				options.add(arg);
			} else {
				positional.add(arg);
			}
		}
		if (positional.size() > 2) {
			throw new IllegalArgumentException("Usage: relay-server [host] [port], got " + positional);
		}

		String host = positional.size() > 0 ? positional.get(0) : null;
		if (host != null && host.isBlank()) {
			throw new IllegalArgumentException("Bind address must not be blank");
		}
		Integer port = positional.size() > 1 ? parsePort(positional.get(1)) : null;
		return new ServerArguments(host, port, List.copyOf(options));
	}

	private static int parsePort(String value) {
		int port;
		try {
			port = Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Port must be a number: " + value, e);
		}
		if (port < 1 || port > 65535) {
			throw new IllegalArgumentException("Port must be between 1 and 65535: " + port);
		}
		return port;
	}

	/**
	 * Arguments for {@link org.springframework.boot.SpringApplication#run}; positional values
	 * become {@code server.address} and {@code server.port}, absent ones fall back to application.yml.
	 */
	public String[] toSpringArguments() {
		List<String> result = new ArrayList<>(options);
		if (host != null) {
			result.add("--server.address=" + host);
		}
		if (port != null) {
			result.add("--server.port=" + port);
		}
		return result.toArray(new String[0]);
	}
}
