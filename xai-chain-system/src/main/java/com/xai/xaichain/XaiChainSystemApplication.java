package com.xai.xaichain;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.xai.xaichain")
public class XaiChainSystemApplication {
    public static void main(String[] args) {
        SpringApplication.run(XaiChainSystemApplication.class, args);
    }
}
