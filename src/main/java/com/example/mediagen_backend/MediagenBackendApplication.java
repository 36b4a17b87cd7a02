package com.example.mediagen_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class MediagenBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(MediagenBackendApplication.class, args);
	}

}
