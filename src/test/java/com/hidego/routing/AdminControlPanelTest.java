package com.hidego.routing;

import com.hidego.correlation.AnonymityChoice;
import com.hidego.correlation.SplitToken;
import com.hidego.transport.InlineKeyboard;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdminControlPanelTest {

    private final SplitToken read = new SplitToken("R".repeat(30), "S".repeat(30), "R".repeat(40));
    private final SplitToken control = new SplitToken("C".repeat(30), "D".repeat(30), "C".repeat(40));

    @Test
    void forwardTextEscapesSenderName() {
        String text = AdminControlPanel.controlText(AnonymityChoice.FORWARD, null, "<b>Mallory</b>");
        assertTrue(text.contains("&lt;b&gt;Mallory&lt;/b&gt;"));
        assertTrue(text.endsWith(AdminControlPanel.HEADER));
    }

    @Test
    void keyboardLayout() {
        InlineKeyboard keyboard = AdminControlPanel.keyboard(read, control, false);

        assertEquals(1, keyboard.rows().get(0).size());
        assertEquals(2, keyboard.rows().get(1).size());
        assertEquals("r|" + "R".repeat(30) + "|" + "S".repeat(30), keyboard.rows().get(0).get(0).callbackData());
        assertEquals(AdminControlPanel.BLOCK_LABEL, keyboard.rows().get(1).get(0).text());
        assertTrue(keyboard.rows().get(1).get(1).callbackData().startsWith("a|"));
    }

    @Test
    void blockStateRelabelsOnlyBlockButton() {
        InlineKeyboard blocked = AdminControlPanel.withBlockState(AdminControlPanel.keyboard(read, control, false), true);

        assertEquals(AdminControlPanel.UNBLOCK_LABEL, blocked.rows().get(1).get(0).text());
        assertEquals(AdminControlPanel.ANSWER_LABEL, blocked.rows().get(1).get(1).text());
        assertEquals(AdminControlPanel.READ_LABEL, blocked.rows().get(0).get(0).text());
    }

    @Test
    void blockedMarkerIsIdempotent() {
        String base = AdminControlPanel.controlText(AnonymityChoice.NO_HISTORY, null, null);
        String marked = AdminControlPanel.withBlockedMarker(base, true);

        assertEquals(marked, AdminControlPanel.withBlockedMarker(marked, true));
        assertEquals(base, AdminControlPanel.withBlockedMarker(marked, false));
        assertEquals(base, AdminControlPanel.withBlockedMarker(base, false));
        assertEquals("", AdminControlPanel.withBlockedMarker(AdminControlPanel.BLOCKED_MARKER, false));
    }

    @Test
    void controlTextIsRebuiltFromPlainEcho() {
        String html = AdminControlPanel.controlText(AnonymityChoice.FORWARD, null, "Ana & Lee");
        String echoed = "😎 Ana & Lee\n" + AdminControlPanel.HEADER + "\n" + AdminControlPanel.BLOCKED_MARKER;

        assertEquals(html, AdminControlPanel.controlTextFromEcho(AnonymityChoice.FORWARD, echoed));
        assertEquals(AdminControlPanel.controlText(AnonymityChoice.WITH_HISTORY, "#aBcDeFgHiJ", null),
                AdminControlPanel.controlTextFromEcho(AnonymityChoice.WITH_HISTORY,
                        "😶‍🌫️💬 #aBcDeFgHiJ\n" + AdminControlPanel.HEADER));
    }
}
