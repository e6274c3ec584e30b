package com.snapshotclaim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SnapshotClaimApplication {

    public static void main(String[] args) {
        SpringApplication.run(SnapshotClaimApplication.class, args);
    }
}
