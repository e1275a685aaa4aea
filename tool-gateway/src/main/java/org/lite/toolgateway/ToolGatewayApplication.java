package org.lite.toolgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ToolGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolGatewayApplication.class, args);
    }
}
