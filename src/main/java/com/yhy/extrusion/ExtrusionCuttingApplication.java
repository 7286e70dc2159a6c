package com.yhy.extrusion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExtrusionCuttingApplication {

	public static void main(String[] args) {
		SpringApplication.run(ExtrusionCuttingApplication.class, args);
	}

}
