package com.venue.scout.recommender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ScoutRecommenderApplication {

	public static void main(String[] args) {
		SpringApplication.run(ScoutRecommenderApplication.class, args);
	}

}
