package com.hidego.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InlineKeyboard(@JsonProperty("inline_keyboard") List<List<InlineButton>> rows) {

    public InlineKeyboard {
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }

    @SafeVarargs
    public static InlineKeyboard of(List<InlineButton>... rows) {
        return new InlineKeyboard(Arrays.asList(rows));
    }

    public static InlineKeyboard single(InlineButton button) {
        return new InlineKeyboard(List.of(List.of(button)));
    }

    public boolean isEmpty() {
        return rows.stream().allMatch(List::isEmpty);
    }

    public Optional<InlineButton> findByCallbackPrefix(String prefix) {
        return rows.stream().flatMap(List::stream)
                .filter(b -> b.callbackData() != null && b.callbackData().startsWith(prefix))
                .findFirst();
    }

    /** Copy without the button carrying {@code callbackData}; rows left empty are dropped. */
    public InlineKeyboard without(String callbackData) {
        List<List<InlineButton>> kept = new ArrayList<>();
        for (List<InlineButton> row : rows) {
            List<InlineButton> remaining = row.stream()
                    .filter(b -> !callbackData.equals(b.callbackData()))
                    .toList();
            if (!remaining.isEmpty()) {
                kept.add(remaining);
            }
        }
        return new InlineKeyboard(kept);
    }
}
