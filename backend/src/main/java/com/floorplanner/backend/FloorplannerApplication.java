package com.floorplanner.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FloorplannerApplication {

	public static void main(String[] args) {
		// UTC keeps log timestamps consistent across hosts
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(FloorplannerApplication.class, args);
	}

}
