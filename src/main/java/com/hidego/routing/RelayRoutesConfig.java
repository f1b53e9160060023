package com.hidego.routing;

import com.hidego.correlation.CallbackData;
import com.hidego.correlation.ControlOperation;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.regex.Pattern;

@Configuration
public class RelayRoutesConfig {

    @Bean
    public UpdateRoutes tenantRoutes(TenantCommandHandler commands,
                                     MessageRouter messages,
                                     AnonymousDispatchHandler anonymousDispatch,
                                     AdminControlHandler adminControls,
                                     ReadReceiptHandler readReceipts) {
        String sep = Pattern.quote(CallbackData.SEPARATOR);
        return UpdateRoutes.builder()
                .onCommand("start", commands::start)
                .onCommand("privacy", commands::privacy)
                .onMessage(messages)
                .onCallback(Pattern.compile(Pattern.quote(CallbackData.ANONYMOUS_PREFIX) + ".+"), anonymousDispatch)
                .onCallback(Pattern.compile(Pattern.quote(CallbackData.CANCEL_REPLY)), adminControls)
                .onCallback(Pattern.compile("[" + ControlOperation.BLOCK.code() + ControlOperation.ANSWER.code() + "]"
                        + sep + ".+"), adminControls)
                .onCallback(Pattern.compile(ControlOperation.READ.code() + sep + ".+"), readReceipts)
                .build();
    }
}
