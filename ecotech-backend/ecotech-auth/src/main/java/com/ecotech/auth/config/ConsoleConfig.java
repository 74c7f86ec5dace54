package com.ecotech.auth.config;

import com.ecotech.auth.api.console.ConsoleIO;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "ecotech.console.enabled", havingValue = "true", matchIfMissing = true)
public class ConsoleConfig {

    @Bean
    public ConsoleIO consoleIO() {
        return ConsoleIO.system();
    }
}
