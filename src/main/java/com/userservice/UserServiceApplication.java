package com.userservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * User service core.
 *
 * Architecture:
 * - PostgreSQL (JPA) as the source of truth, written inside explicit units of work
 * - Redis as a cache-aside / write-through mirror with a fixed TTL
 * - SQS for at-least-once messaging, acknowledged by receipt handle
 * - Optional background subscriber polling the queue with a fixed retry delay
 */
@SpringBootApplication
@EnableTransactionManagement
public class UserServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(UserServiceApplication.class, args);
    }
}
