package com.hidego;

import com.hidego.crypto.MasterPassphraseInitializer;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@EnableScheduling
public class HidegoApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(HidegoApplication.class);
        application.addInitializers(new MasterPassphraseInitializer());
        application.run(args);
    }
}
