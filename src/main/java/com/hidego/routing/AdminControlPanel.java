package com.hidego.routing;

import com.hidego.correlation.AnonymityChoice;
import com.hidego.correlation.CallbackData;
import com.hidego.correlation.ControlOperation;
import com.hidego.correlation.SplitToken;
import com.hidego.transport.InlineButton;
import com.hidego.transport.InlineKeyboard;
import org.springframework.web.util.HtmlUtils;

import java.util.List;

/**
 * Texts and keyboards of the admin-side control message that accompanies every
 * delivered anonymous message, and of the Read button on delivered replies.
 */
public final class AdminControlPanel {

    public static final String HEADER = "🎛️ Admin controls:";
    public static final String BLOCKED_MARKER = "#BLOCKED";

    static final String READ_LABEL = "👀 Read";
    static final String BLOCK_LABEL = "🚫 Block";
    static final String UNBLOCK_LABEL = "🕊️ Unblock";
    static final String ANSWER_LABEL = "👋 Answer";

    private static final String NO_HISTORY_MARK = "😶‍🌫️";
    private static final String WITH_HISTORY_MARK = "😶‍🌫️💬 ";
    private static final String FORWARD_MARK = "😎 ";

    private static final String BLOCK_PREFIX = ControlOperation.BLOCK.code() + CallbackData.SEPARATOR;

    private AdminControlPanel() {}

    /** HTML text of the control message for one delivered message. */
    public static String controlText(AnonymityChoice choice, String anonymousId, String senderName) {
        return switch (choice) {
            case NO_HISTORY -> NO_HISTORY_MARK + "\n" + HEADER;
            case WITH_HISTORY -> WITH_HISTORY_MARK + HtmlUtils.htmlEscape(anonymousId) + "\n" + HEADER;
            case FORWARD -> FORWARD_MARK + "<code>" + HtmlUtils.htmlEscape(senderName) + "</code>\n" + HEADER;
        };
    }

    /**
     * Rebuilds the HTML control text from the plain text the platform echoes back in a
     * callback, where formatting is already stripped. Any blocked marker is dropped.
     */
    public static String controlTextFromEcho(AnonymityChoice choice, String echoed) {
        String firstLine = echoed == null ? "" : echoed.split("\n", 2)[0];
        return switch (choice) {
            case NO_HISTORY -> controlText(choice, null, null);
            case WITH_HISTORY -> controlText(choice, stripMark(firstLine, WITH_HISTORY_MARK), null);
            case FORWARD -> controlText(choice, null, stripMark(firstLine, FORWARD_MARK));
        };
    }

    private static String stripMark(String line, String mark) {
        return line.startsWith(mark) ? line.substring(mark.length()) : line;
    }

    /** Rows: [Read], [Block or Unblock, Answer]. */
    public static InlineKeyboard keyboard(SplitToken read, SplitToken control, boolean blocked) {
        return InlineKeyboard.of(
                List.of(InlineButton.callback(READ_LABEL, read.toPayload(ControlOperation.READ))),
                List.of(InlineButton.callback(blocked ? UNBLOCK_LABEL : BLOCK_LABEL,
                                control.toPayload(ControlOperation.BLOCK)),
                        InlineButton.callback(ANSWER_LABEL, control.toPayload(ControlOperation.ANSWER))));
    }

    public static InlineKeyboard readOnly(SplitToken read) {
        return InlineKeyboard.single(InlineButton.callback(READ_LABEL, read.toPayload(ControlOperation.READ)));
    }

    /** Same keyboard with the block button labelled for the new state. */
    public static InlineKeyboard withBlockState(InlineKeyboard keyboard, boolean blocked) {
        return new InlineKeyboard(keyboard.rows().stream()
                .map(row -> row.stream()
                        .map(button -> button.callbackData() != null && button.callbackData().startsWith(BLOCK_PREFIX)
                                ? InlineButton.callback(blocked ? UNBLOCK_LABEL : BLOCK_LABEL, button.callbackData())
                                : button)
                        .toList())
                .toList());
    }

    /** Adds or removes the trailing blocked marker; applying the same state twice is a no-op. */
    public static String withBlockedMarker(String text, boolean blocked) {
        String base = text == null ? "" : text;
        String suffix = "\n" + BLOCKED_MARKER;
        boolean marked = base.endsWith(suffix) || base.equals(BLOCKED_MARKER);
        if (blocked) {
            return marked ? base : base + suffix;
        }
        if (!marked) {
            return base;
        }
        return base.equals(BLOCKED_MARKER) ? "" : base.substring(0, base.length() - suffix.length());
    }
}
