package com.hidego.routing;

import com.hidego.i18n.ResponseKey;
import com.hidego.i18n.ResponseTexts;
import com.hidego.tenant.CreatorBotIdentity;
import com.hidego.transport.OutboundMessage;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * /start and /privacy of tenant bots.
 */
@Component
public class TenantCommandHandler {

    private final ResponseTexts texts;
    private final CreatorBotIdentity creatorIdentity;

    public TenantCommandHandler(ResponseTexts texts, CreatorBotIdentity creatorIdentity) {
        this.texts = texts;
        this.creatorIdentity = creatorIdentity;
    }

    public Mono<Void> start(UpdateContext context) {
        String creator = creatorIdentity.username().orElse(context.botUsername());
        return send(context, texts.get(ResponseKey.START, context.languageCode(), creator));
    }

    public Mono<Void> privacy(UpdateContext context) {
        return send(context, texts.get(ResponseKey.PRIVACY, context.languageCode()));
    }

    private Mono<Void> send(UpdateContext context, String text) {
        return context.transport()
                .sendMessage(OutboundMessage.text(context.message().chat().id(), text).html().noPreview())
                .then();
    }
}
