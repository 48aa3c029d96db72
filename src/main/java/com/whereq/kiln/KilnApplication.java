package com.whereq.kiln;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Kiln.
 * This service queues operating system image builds per tenant and tier and
 * drives each build through its phases as a DAG of toolchain steps.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class KilnApplication {

    public static void main(String[] args) {
        SpringApplication.run(KilnApplication.class, args);
    }
}
