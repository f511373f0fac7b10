package com.plotlab.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.plotlab.debug.ConsoleDebugSink;
import com.plotlab.debug.Debug;
import com.plotlab.debug.DebugLevel;
import com.plotlab.expr.ExpressionEngine;
import com.plotlab.game.GameConfig;
import com.plotlab.game.GameConfigException;
import com.plotlab.game.GameConfigLoader;
import com.plotlab.game.HintResult;
import com.plotlab.game.PlotChallenge;
import com.plotlab.game.ProgressSnapshot;
import com.plotlab.game.RandomSource;

/**
 * Line-oriented console front end for a {@link PlotChallenge} session.
 *
 * Any line not starting with ':' is taken as the player's expression.
 * Commands: :new :skip :hint :enter :state :json :help :quit
 *
 * Flags: --config=/path/rules.json  --seed=N  --log=trace|debug|info|warn|error
 */
public final class PlotChallengeCli {

    private static final ObjectMapper om = new ObjectMapper();

    private final PlotChallenge game;
    private final PrintStream out;

    public PlotChallengeCli(PlotChallenge game, PrintStream out) {
        this.game = game;
        this.out = out;
    }

    public static void main(String[] args) {
        Map<String, String> flags = parseArgs(args);

        if (flags.containsKey("log")) {
            DebugLevel level;
            try {
                level = DebugLevel.valueOf(flags.get("log").toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                System.err.println("Unknown log level: " + flags.get("log"));
                System.exit(2);
                return;
            }
            Debug.get().setSink(new ConsoleDebugSink(level));
        }

        ExpressionEngine engine = new ExpressionEngine();
        GameConfigLoader loader = new GameConfigLoader(engine);
        GameConfig config;
        try {
            config = flags.containsKey("config")
                    ? loader.load(Path.of(flags.get("config")))
                    : loader.loadDefaultResource();
        } catch (GameConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            System.exit(3);
            return;
        }

        RandomSource random;
        try {
            random = flags.containsKey("seed")
                    ? RandomSource.seeded(Long.parseLong(flags.get("seed")))
                    : RandomSource.system();
        } catch (NumberFormatException e) {
            System.err.println("--seed must be an integer: " + flags.get("seed"));
            System.exit(2);
            return;
        }

        PlotChallengeCli cli = new PlotChallengeCli(new PlotChallenge(config, engine, random), System.out);
        System.out.println("Function plotting challenge. Type an expression in x, or :help.");
        cli.printState();

        BufferedReader br = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            while (true) {
                System.out.print("> ");
                String line = br.readLine();
                if (line == null) break;
                if (!cli.handle(line)) break;
            }
        } catch (IOException e) {
            Debug.get().e(Debug.TAG_CLI, "stdin failed", e);
            System.exit(1);
        }
    }

    /**
     * Applies one input line.
     *
     * @return false when the session should end
     */
    public boolean handle(String line) {
        String trimmed = line.trim();

        if (!trimmed.startsWith(":")) {
            game.setPlayerText(trimmed);
            printState();
            return true;
        }

        String cmd = trimmed.substring(1).toLowerCase(Locale.ROOT);
        switch (cmd) {
            case "quit":
            case "exit":
                return false;
            case "new":
                game.startNewLevel();
                printState();
                break;
            case "skip":
                game.skipLevel();
                printState();
                break;
            case "enter":
                if (game.confirmWin()) {
                    out.println("Next level!");
                } else {
                    out.println("Not matched yet.");
                }
                printState();
                break;
            case "hint":
                HintResult hint = game.requestHint();
                out.println(hint.isAvailable() ? "HINT: " + hint.getText() : hint.getText());
                break;
            case "state":
                printState();
                break;
            case "json":
                out.println(toJson(game.snapshot()));
                break;
            case "help":
                printHelp();
                break;
            default:
                out.println("Unknown command '" + trimmed + "'. Type :help.");
        }
        return true;
    }

    void printState() {
        ProgressSnapshot s = game.snapshot();
        out.println(s);
        if (!game.getPlayerText().isEmpty()) {
            if (game.getPlayerError() != null) {
                out.println("  invalid: " + game.getPlayerError());
            } else if (!s.valid) {
                out.println("  no plottable point in [" + s.domainMin + ", " + s.domainMax + "]");
            } else if (s.win) {
                out.println("  MATCH! type :enter for the next level");
            }
        }
    }

    private void printHelp() {
        out.println("  <expression>  set your attempt, e.g. 2 * sin(x) + 1");
        out.println("  :new          new target at the current level");
        out.println("  :skip         skip this target (score penalty)");
        out.println("  :hint         reveal something about the target");
        out.println("  :enter        continue after a match");
        out.println("  :state        show level, score and error");
        out.println("  :json         dump the session state as JSON");
        out.println("  :quit         leave");
    }

    static String toJson(ProgressSnapshot s) {
        ObjectNode root = om.createObjectNode();
        root.put("level", s.level);
        root.put("difficulty", s.difficulty.id());
        root.put("roundTier", s.roundTier.id());
        root.put("score", s.score);
        root.put("hintsRemaining", s.hintsRemaining);
        root.put("playerText", s.playerText);
        root.put("valid", s.valid);
        root.put("win", s.win);
        if (s.currentError().isPresent()) root.put("currentError", s.currentError().getAsDouble());
        else root.putNull("currentError");

        ArrayNode domain = root.putArray("domain");
        domain.add(s.domainMin);
        domain.add(s.domainMax);
        ArrayNode yRange = root.putArray("yRange");
        yRange.add(s.yRange.min);
        yRange.add(s.yRange.max);

        root.put("targetPoints", s.targetCurve.size());
        root.put("playerPoints", s.playerCurve.size());
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render state", e);
        }
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<String, String>();
        for (String a : args) {
            if (a.startsWith("--") && a.indexOf('=') >= 0) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }
}
