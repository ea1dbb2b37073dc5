package com.quichat;

import com.quichat.config.ChatProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Terminal chat over a shared LAN topic.
 * <p>
 * Usage: {@code java -jar quichat.jar --quichat.nick=alice [--quichat.port=4001]}
 */
@SpringBootApplication
@EnableConfigurationProperties(ChatProperties.class)
public class QuichatApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(QuichatApplication.class, args)));
    }
}
