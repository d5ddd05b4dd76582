package com.example.snapshotcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SnapshotCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(SnapshotCacheApplication.class, args);
    }
}
