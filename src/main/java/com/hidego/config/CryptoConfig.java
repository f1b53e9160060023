package com.hidego.config;

import com.hidego.crypto.AnonymousIdGenerator;
import com.hidego.crypto.Encryptor;
import com.hidego.crypto.MasterPassphrase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Crypto services built from the master passphrase registered by
 * {@link com.hidego.crypto.MasterPassphraseInitializer}.
 */
@Configuration
public class CryptoConfig {

    @Bean
    public Encryptor encryptor(MasterPassphrase masterPassphrase) {
        return new Encryptor(masterPassphrase);
    }

    @Bean
    public AnonymousIdGenerator anonymousIdGenerator(MasterPassphrase masterPassphrase) {
        return new AnonymousIdGenerator(masterPassphrase);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
