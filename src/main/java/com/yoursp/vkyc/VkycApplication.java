package com.yoursp.vkyc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VkycApplication {

    public static void main(String[] args) {
        SpringApplication.run(VkycApplication.class, args);
    }
}
