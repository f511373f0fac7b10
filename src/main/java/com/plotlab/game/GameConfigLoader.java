package com.plotlab.game;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plotlab.debug.Debug;
import com.plotlab.expr.ExpressionEngine;
import com.plotlab.sampling.SamplingSettings;
import com.plotlab.sampling.YRange;

/**
 * Reads a {@link GameConfig} from JSON.
 *
 * Every section is optional; anything left out keeps the stock value from
 * {@link GameConfig#defaultsBuilder()}. Layout:
 *
 * <pre>
 * {
 *   "domain":    { "min": 0, "max": 10, "steps": 400 },
 *   "plot":      { "marginRatio": 0.2, "constantPadding": 1.0, "fallbackRange": [-5, 5] },
 *   "scoring":   { "skipPenalty": 50, "initialHints": 3, "errorEpsilon": 1e-6 },
 *   "tiers":     { "easy": { "threshold": 3, "points": 100, "errorTolerance": 0.05 }, ...,
 *                  "expert": { "threshold": null, "points": 500, "errorTolerance": 0.02 } },
 *   "templates": { "easy": ["sin(x)", ...], ... },
 *   "hints":     { "replaceFacts": false, "facts": { "sin": "Uses sine function", ... },
 *                  "fallback": "..." }
 * }
 * </pre>
 *
 * A null threshold marks a catch-all tier. Templates are compiled
 * before the config is returned.
 */
public final class GameConfigLoader {

    /** Classpath location of the bundled rules. */
    public static final String DEFAULT_RESOURCE = "/plotlab-defaults.json";

    private static final ObjectMapper om = new ObjectMapper();

    private final ExpressionEngine engine;

    public GameConfigLoader(ExpressionEngine engine) {
        if (engine == null) throw new IllegalArgumentException("engine must not be null");
        this.engine = engine;
    }

    public GameConfig loadDefaultResource() {
        try (InputStream in = GameConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new GameConfigException("Missing classpath resource " + DEFAULT_RESOURCE);
            return fromTree(om.readTree(in), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new GameConfigException("Failed to read " + DEFAULT_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    public GameConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromTree(om.readTree(in), path.toString());
        } catch (IOException e) {
            throw new GameConfigException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    public GameConfig parse(String json) {
        try {
            return fromTree(om.readTree(json), "<inline>");
        } catch (IOException e) {
            throw new GameConfigException("Invalid config JSON: " + e.getMessage(), e);
        }
    }

    private GameConfig fromTree(JsonNode root, String origin) {
        if (root == null || !root.isObject()) {
            throw new GameConfigException(origin + ": top level must be a JSON object");
        }
        GameConfig.Builder b = GameConfig.defaultsBuilder();
        GameConfig stock = GameConfig.defaults();

        readSampling(root, b, stock.getSampling());
        readScoring(root.path("scoring"), b);
        readTiers(root.path("tiers"), b, stock);
        readTemplates(root.path("templates"), b);
        readHints(root.path("hints"), b);

        GameConfig config = b.build();
        config.validateTemplates(engine);
        Debug.get().i(Debug.TAG_CONFIG, "loaded config from " + origin);
        return config;
    }

    private void readSampling(JsonNode root, GameConfig.Builder b, SamplingSettings stock) {
        JsonNode domain = root.path("domain");
        JsonNode plot = root.path("plot");
        if (domain.isMissingNode() && plot.isMissingNode()) return;

        JsonNode fr = plot.path("fallbackRange");
        if (!fr.isMissingNode() && (!fr.isArray() || fr.size() != 2)) {
            throw new GameConfigException("plot.fallbackRange must be a two-element array");
        }

        try {
            YRange fallback = fr.isMissingNode()
                    ? stock.fallbackRange
                    : new YRange(number(fr.get(0), "plot.fallbackRange[0]"), number(fr.get(1), "plot.fallbackRange[1]"));
            b.sampling(new SamplingSettings(
                    optDouble(domain, "min", stock.xMin),
                    optDouble(domain, "max", stock.xMax),
                    optInt(domain, "steps", stock.steps),
                    optDouble(plot, "marginRatio", stock.marginRatio),
                    optDouble(plot, "constantPadding", stock.constantPadding),
                    fallback));
        } catch (IllegalArgumentException e) {
            throw new GameConfigException("Invalid sampling settings: " + e.getMessage(), e);
        }
    }

    private void readScoring(JsonNode scoring, GameConfig.Builder b) {
        if (scoring.isMissingNode()) return;
        if (scoring.has("skipPenalty")) b.skipPenalty(optInt(scoring, "skipPenalty", 0));
        if (scoring.has("initialHints")) b.initialHints(optInt(scoring, "initialHints", 0));
        if (scoring.has("errorEpsilon")) b.errorEpsilon(optDouble(scoring, "errorEpsilon", 0));
    }

    private void readTiers(JsonNode tiers, GameConfig.Builder b, GameConfig stock) {
        if (tiers.isMissingNode()) return;
        Iterator<Map.Entry<String, JsonNode>> it = tiers.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            DifficultyTier tier = tierId(e.getKey());
            JsonNode n = e.getValue();
            TierSettings base = stock.getTier(tier);

            int threshold;
            if (!n.has("threshold")) {
                threshold = base.levelThreshold;
            } else if (n.get("threshold").isNull()) {
                threshold = TierSettings.UNBOUNDED;
            } else {
                threshold = optInt(n, "threshold", base.levelThreshold);
            }
            try {
                b.tier(new TierSettings(tier, threshold,
                        optInt(n, "points", base.points),
                        optDouble(n, "errorTolerance", base.errorTolerance)));
            } catch (IllegalArgumentException ex) {
                throw new GameConfigException("Invalid tier " + tier.id() + ": " + ex.getMessage(), ex);
            }
        }
    }

    private void readTemplates(JsonNode templates, GameConfig.Builder b) {
        if (templates.isMissingNode()) return;
        Iterator<Map.Entry<String, JsonNode>> it = templates.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            DifficultyTier tier = tierId(e.getKey());
            if (!e.getValue().isArray()) {
                throw new GameConfigException("templates." + e.getKey() + " must be an array of strings");
            }
            List<String> list = new ArrayList<>();
            for (JsonNode t : e.getValue()) {
                if (!t.isTextual()) throw new GameConfigException("templates." + e.getKey() + " entries must be strings");
                list.add(t.asText());
            }
            b.templates(tier, list);
        }
    }

    private void readHints(JsonNode hints, GameConfig.Builder b) {
        if (hints.isMissingNode()) return;
        if (hints.path("replaceFacts").asBoolean(false)) b.clearHintFacts();
        JsonNode facts = hints.path("facts");
        if (!facts.isMissingNode()) {
            Iterator<Map.Entry<String, JsonNode>> it = facts.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                b.hintFact(e.getKey(), e.getValue().asText());
            }
        }
        if (hints.has("fallback")) b.fallbackHint(hints.get("fallback").asText());
    }

    // ===================== HELPERS =====================

    private static DifficultyTier tierId(String id) {
        try {
            return DifficultyTier.fromId(id);
        } catch (IllegalArgumentException e) {
            throw new GameConfigException(e.getMessage(), e);
        }
    }

    private static double optDouble(JsonNode node, String field, double dflt) {
        JsonNode v = node.path(field);
        if (v.isMissingNode() || v.isNull()) return dflt;
        return number(v, field);
    }

    private static int optInt(JsonNode node, String field, int dflt) {
        JsonNode v = node.path(field);
        if (v.isMissingNode() || v.isNull()) return dflt;
        if (!v.canConvertToInt() || !v.isIntegralNumber()) {
            throw new GameConfigException("'" + field + "' must be an integer, got " + v);
        }
        return v.asInt();
    }

    private static double number(JsonNode v, String field) {
        if (v == null || !v.isNumber()) throw new GameConfigException("'" + field + "' must be a number, got " + v);
        return v.asDouble();
    }
}
