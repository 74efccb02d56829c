package com.agilab.image_archiving;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ImageArchivingApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ImageArchivingApplication.class, args)));
    }
}
