package com.echo.signaling_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.client.discovery.EnableDiscoveryClient;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@EnableDiscoveryClient
@SpringBootApplication
public class SignalingServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(SignalingServiceApplication.class, args);
	}

}
