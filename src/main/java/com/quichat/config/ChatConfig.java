package com.quichat.config;

import com.quichat.messaging.model.LocalIdentity;
import com.quichat.terminal.ConsoleTerminal;
import com.quichat.terminal.Terminal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Clock;

@Configuration
public class ChatConfig {

    private static final Logger logger = LoggerFactory.getLogger(ChatConfig.class);

    @Bean
    public LocalIdentity localIdentity(ChatProperties properties) {
        LocalIdentity identity = LocalIdentity.withRandomSessionId(properties.nick());
        logger.info("Local identity: {}", identity);
        return identity;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public Terminal terminal() throws IOException {
        return ConsoleTerminal.system();
    }
}
