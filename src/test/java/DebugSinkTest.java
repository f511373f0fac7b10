import com.plotlab.debug.ConsoleDebugSink;
import com.plotlab.debug.Debug;
import com.plotlab.debug.DebugLevel;
import com.plotlab.game.GameConfig;
import com.plotlab.game.PlotChallenge;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugSinkTest {

    private static final class Line {
        final DebugLevel level;
        final String tag;
        final String message;

        Line(DebugLevel level, String tag, String message) {
            this.level = level;
            this.tag = tag;
            this.message = message;
        }
    }

    @AfterEach
    void resetSink() {
        Debug.get().setSink(null);
    }

    @Test
    void loggingWorksBeforeAnySinkIsInstalled() {
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().i(Debug.TAG_GAME, "no sink yet"));
        assertDoesNotThrow(() -> {
            PlotChallenge game = new PlotChallenge(GameConfig.defaults(), bound -> 0);
            game.setPlayerText("1 / x");
            game.setPlayerText("sin(");
        });
    }

    @Test
    void sessionEventsReachInstalledSink() {
        List<Line> lines = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> lines.add(new Line(level, tag, message)));
        assertTrue(Debug.get().enabled());

        PlotChallenge game = new PlotChallenge(GameConfig.defaults(), bound -> 0);
        game.setPlayerText("sin(x)");
        game.skipLevel();

        assertTrue(lines.stream().anyMatch(l -> l.level == DebugLevel.INFO
                && Debug.TAG_GAME.equals(l.tag) && l.message.startsWith("level 1")));
        assertTrue(lines.stream().anyMatch(l -> Debug.TAG_GAME.equals(l.tag) && l.message.startsWith("win")));
        assertTrue(lines.stream().anyMatch(l -> Debug.TAG_GAME.equals(l.tag) && l.message.startsWith("skip")));
    }

    @Test
    void noSinkMeansDisabled() {
        Debug.get().setSink(null);
        assertFalse(Debug.get().enabled());
        Debug.get().i(Debug.TAG_GAME, "goes nowhere");
    }

    @Test
    void consoleSinkFiltersByLevel() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(buf, true, StandardCharsets.UTF_8);
        ConsoleDebugSink sink = new ConsoleDebugSink(ps, DebugLevel.WARN);

        sink.log(DebugLevel.DEBUG, "t", "quiet", null);
        sink.log(DebugLevel.WARN, "t", "loud", null);
        sink.log(DebugLevel.ERROR, "t", "louder", new IllegalStateException("boom"));

        String out = buf.toString(StandardCharsets.UTF_8);
        assertFalse(out.contains("quiet"));
        assertTrue(out.contains("WARN [t] loud"));
        assertTrue(out.contains("ERROR [t] louder"));
        assertTrue(out.contains("boom"));
    }
}
