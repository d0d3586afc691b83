package com.rebenew.watchParty.syncserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class WatchPartySyncServerApplication {
	private static final Logger logger = LoggerFactory.getLogger(WatchPartySyncServerApplication.class);

	public static void main(String[] args) {
		Environment env = SpringApplication.run(WatchPartySyncServerApplication.class, args).getEnvironment();
		logger.info("🚀 Servidor de sync escuchando en puerto {} (ruta WebSocket {})",
				env.getProperty("server.port", "8080"), env.getProperty("watchparty.websocket.path", "/ws/sync"));
	}
}
