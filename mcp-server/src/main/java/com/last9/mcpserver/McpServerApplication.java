package com.last9.mcpserver;

import com.last9.mcpserver.tools.TelemetryToolService;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import lombok.extern.log4j.Log4j2;

@SpringBootApplication
@Log4j2
public class McpServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(McpServerApplication.class, args);
	}

	@Bean
	public ToolCallbackProvider telemetryTools(TelemetryToolService telemetryToolService) {
		log.info("Registering Last9 telemetry tools with MCP server");
		ToolCallbackProvider provider = MethodToolCallbackProvider.builder().toolObjects(telemetryToolService).build();
		log.info("Registered {} tools", provider.getToolCallbacks().length);
		return provider;
	}
}
