package com.tfigtfs.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TfiGtfsApplication {

	public static void main(String[] args) {
		SpringApplication.run(TfiGtfsApplication.class, args);
	}

}
