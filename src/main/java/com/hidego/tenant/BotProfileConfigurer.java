package com.hidego.tenant;

import com.hidego.i18n.ResponseKey;
import com.hidego.i18n.ResponseTexts;
import com.hidego.i18n.SupportedLanguage;
import com.hidego.transport.BotCommand;
import com.hidego.transport.BotTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Publishes localized bot profile texts and command menus. The English set is also
 * published as the default for users of other languages.
 */
@Component
public class BotProfileConfigurer {

    private static final Logger log = LoggerFactory.getLogger(BotProfileConfigurer.class);

    private final ResponseTexts texts;

    public BotProfileConfigurer(ResponseTexts texts) {
        this.texts = texts;
    }

    public Mono<Void> configureTenant(BotTransport transport, String creatorUsername) {
        return Flux.fromArray(SupportedLanguage.values())
                .concatMap(language -> {
                    Mono<Void> commands = publishCommands(transport, language, List.of(
                            command("start", ResponseKey.COMMAND_START, language),
                            command("privacy", ResponseKey.COMMAND_PRIVACY, language)));
                    if (creatorUsername == null) {
                        return commands;
                    }
                    String shortDescription = texts.get(ResponseKey.TENANT_SHORT_DESCRIPTION, language, creatorUsername);
                    return commands.then(publishShortDescription(transport, language, shortDescription));
                })
                .then();
    }

    public Mono<Void> configureDispatcher(BotTransport transport) {
        return Flux.fromArray(SupportedLanguage.values())
                .concatMap(language -> publishCommands(transport, language, List.of(
                                command("start", ResponseKey.COMMAND_START, language),
                                command("register", ResponseKey.COMMAND_REGISTER, language),
                                command("revoke", ResponseKey.COMMAND_REVOKE, language),
                                command("privacy", ResponseKey.COMMAND_PRIVACY, language),
                                command("about", ResponseKey.COMMAND_ABOUT, language)))
                        .then(publishShortDescription(transport, language,
                                texts.get(ResponseKey.DISPATCHER_SHORT_DESCRIPTION, language)))
                        .then(publishDescription(transport, language,
                                texts.get(ResponseKey.DISPATCHER_DESCRIPTION, language))))
                .then()
                .doOnSuccess(v -> log.info("Dispatcher profile published"));
    }

    private Mono<Void> publishCommands(BotTransport transport, SupportedLanguage language, List<BotCommand> commands) {
        Mono<Void> localized = transport.setMyCommands(commands, language.code());
        return language == SupportedLanguage.EN
                ? transport.setMyCommands(commands, null).then(localized)
                : localized;
    }

    private Mono<Void> publishShortDescription(BotTransport transport, SupportedLanguage language, String text) {
        Mono<Void> localized = transport.setMyShortDescription(text, language.code());
        return language == SupportedLanguage.EN
                ? transport.setMyShortDescription(text, null).then(localized)
                : localized;
    }

    private Mono<Void> publishDescription(BotTransport transport, SupportedLanguage language, String text) {
        Mono<Void> localized = transport.setMyDescription(text, language.code());
        return language == SupportedLanguage.EN
                ? transport.setMyDescription(text, null).then(localized)
                : localized;
    }

    private BotCommand command(String name, ResponseKey description, SupportedLanguage language) {
        return new BotCommand(name, texts.get(description, language));
    }
}
