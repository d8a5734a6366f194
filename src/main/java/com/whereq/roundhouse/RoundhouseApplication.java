package com.whereq.roundhouse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Roundhouse.
 * This service admits container build jobs, dispatches them to build workers through a
 * shared Redis queue, streams their logs and delivers their results to a callback URL.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class RoundhouseApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoundhouseApplication.class, args);
    }
}
