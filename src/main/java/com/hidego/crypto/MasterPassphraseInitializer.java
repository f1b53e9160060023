package com.hidego.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Path;

/**
 * Prompts for the master passphrase before the context refreshes and registers it as
 * the {@code masterPassphrase} singleton. Startup aborts when no passphrase is given.
 */
public class MasterPassphraseInitializer implements ApplicationContextInitializer<ConfigurableApplicationContext> {

    private static final Logger log = LoggerFactory.getLogger(MasterPassphraseInitializer.class);

    static final String BEAN_NAME = "masterPassphrase";

    @Override
    public void initialize(ConfigurableApplicationContext context) {
        if (context.getBeanFactory().containsSingleton(BEAN_NAME)) {
            return;
        }
        String recordFile = context.getEnvironment()
                .getProperty("hidego.security.passphrase-file", "config.secure");

        PassphrasePrompt prompt = new PassphrasePrompt(new SystemSecretConsole(), Path.of(recordFile));
        MasterPassphrase passphrase = prompt.obtain()
                .orElseThrow(() -> new IllegalStateException("Master passphrase was not provided"));

        context.getBeanFactory().registerSingleton(BEAN_NAME, passphrase);
        log.info("Master passphrase accepted");
    }
}
