package com.example.audit;

import com.example.audit.config.AuditProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AuditProperties.class)
public class AuditAgentApplication {

	public static void main(String[] args) {
		SpringApplication.run(AuditAgentApplication.class, args);
	}

}
