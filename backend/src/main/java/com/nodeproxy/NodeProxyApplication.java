package com.nodeproxy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NodeProxyApplication {

    public static void main(String[] args) {
        SpringApplication.run(NodeProxyApplication.class, args);
    }
}
