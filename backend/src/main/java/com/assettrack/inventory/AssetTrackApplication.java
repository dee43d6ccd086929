package com.assettrack.inventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssetTrackApplication {
    public static void main(String[] args) {
        SpringApplication.run(AssetTrackApplication.class, args);
    }
}
