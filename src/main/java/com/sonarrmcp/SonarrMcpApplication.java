package com.sonarrmcp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SonarrMcpApplication {

	public static void main(String[] args) {
        SpringApplication app = new SpringApplication(SonarrMcpApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
	}

}
