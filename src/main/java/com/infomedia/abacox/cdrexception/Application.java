package com.infomedia.abacox.cdrexception;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import jakarta.annotation.PostConstruct;

@SpringBootApplication
public class Application {
	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(Application.class, args)));
	}

	@PostConstruct
	public void init() {
		// CDR timestamps and the run window are UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
	}
}
