package com.platform.kothak;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Kothak resource bootstrapper.
 *
 * Brings up every configured SQL database, Redis endpoint and object storage bucket
 * concurrently at startup and exposes them by name through the {@code Kothak} registry.
 */
@SpringBootApplication
public class KothakApplication {

    public static void main(String[] args) {
        SpringApplication.run(KothakApplication.class, args);
    }
}
