package com.example.platformsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PlatformSyncApplication {

	public static void main(String[] args) {
		SpringApplication.run(PlatformSyncApplication.class, args);
	}

}
