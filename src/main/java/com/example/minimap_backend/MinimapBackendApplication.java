package com.example.minimap_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class MinimapBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(MinimapBackendApplication.class, args);
	}

}
