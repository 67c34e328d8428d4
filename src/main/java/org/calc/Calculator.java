package org.calc;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class Calculator {

    // =========================================================
    // Configuration
    // =========================================================
    static final String CONFIG_FILE = "calculator.json";
    static final String PI = "pi";

    // =========================================================
    // Entry
    // =========================================================
    public static void main(String[] args) {
        try {
            Config config = Config.load();
            if (args.length >= 2 && "--batch".equals(args[0])) {
                Path input = Paths.get(args[1]);
                Path output = args.length >= 3 ? Paths.get(args[2]) : null;
                Batch.run(config, input, output, System.out);
                return;
            }
            if (args.length > 0) {
                System.err.println("usage: calculator [--batch <input.json> [output.json]]");
                System.exit(1);
            }
            Session session = new Session(new Parser(), newEnvironment(config), config, System.out);
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            session.run(in);
        } catch (CalcException | InputError e) {
            System.err.println("ERROR: " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            e.printStackTrace();
            System.exit(3);
        }
    }

    /**
     * Environment seeded with {@code pi} and the configured constants.
     */
    static Environment newEnvironment(Config config) {
        Environment env = new Environment();
        env.assign(PI, Math.asin(1.0) * 2.0);
        for (Map.Entry<String, Double> c : config.constants.entrySet()) env.assign(c.getKey(), c.getValue());
        return env;
    }

    // =========================================================
    // Exceptions
    // =========================================================
    static final class InputError extends RuntimeException {
        InputError(String code, String msg){ super(code + ": " + msg); }
    }

    // =========================================================
    // Config
    // =========================================================
    static final class Config {
        private static final ObjectMapper MAPPER = new ObjectMapper();

        final String prompt;
        final int historySize;
        final boolean colors;
        final String resultVariable;
        final Map<String, Double> constants;

        Config(String prompt, int historySize, boolean colors, String resultVariable, Map<String, Double> constants) {
            if (historySize < 0) throw new InputError("CONFIG_ERROR", "historySize must be >= 0, got " + historySize);
            this.prompt = prompt;
            this.historySize = historySize;
            this.colors = colors;
            this.resultVariable = resultVariable;
            this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(constants));
        }

        static Config defaults() {
            return new Config("> ", 10, true, "ans", Collections.emptyMap());
        }

        static Config load() {
            return load(Paths.get(CONFIG_FILE));
        }

        /**
         * Load {@code userFile} if it exists, so a file next to the user overrides the bundled one;
         * otherwise calculator.json from the classpath; defaults if neither exists.
         */
        static Config load(Path userFile) {
            if (Files.isRegularFile(userFile)) return loadFile(userFile);
            try (InputStream in = Calculator.class.getResourceAsStream("/" + CONFIG_FILE)) {
                if (in != null) return fromJson(MAPPER.readTree(in), "classpath:" + CONFIG_FILE);
            } catch (IOException e) {
                throw new InputError("CONFIG_ERROR", "cannot read classpath:" + CONFIG_FILE + " - " + e.getMessage());
            }
            return defaults();
        }

        static Config loadFile(Path path) {
            try {
                return fromJson(MAPPER.readTree(path.toFile()), path.toString());
            } catch (IOException e) {
                throw new InputError("CONFIG_ERROR", "cannot read " + path + " - " + e.getMessage());
            }
        }

        static Config fromJson(JsonNode root, String source) {
            if (root == null || !root.isObject()) throw new InputError("CONFIG_ERROR", source + " must be a JSON object");
            Config d = defaults();
            String prompt = root.has("prompt") ? root.get("prompt").asText() : d.prompt;
            String resultVariable = root.has("resultVariable") ? root.get("resultVariable").asText() : d.resultVariable;
            boolean colors = root.has("colors") ? root.get("colors").asBoolean() : d.colors;
            int historySize = d.historySize;
            if (root.has("historySize")) {
                JsonNode h = root.get("historySize");
                if (!h.canConvertToInt()) throw new InputError("CONFIG_ERROR", "historySize in " + source + " must be an integer");
                historySize = h.asInt();
            }
            Map<String, Double> constants = new LinkedHashMap<>();
            JsonNode c = root.get("constants");
            if (c != null && !c.isNull()) {
                if (!c.isObject()) throw new InputError("CONFIG_ERROR", "constants in " + source + " must be an object");
                Iterator<Map.Entry<String, JsonNode>> it = c.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    if (!e.getValue().isNumber()) {
                        throw new InputError("CONFIG_ERROR", "constant '" + e.getKey() + "' in " + source + " must be numeric");
                    }
                    constants.put(e.getKey(), e.getValue().asDouble());
                }
            }
            return new Config(prompt, historySize, colors, resultVariable, constants);
        }
    }

    // =========================================================
    // History
    // =========================================================
    static final class History {
        static final class Entry {
            final String expr; final double result;
            Entry(String expr, double result){ this.expr = expr; this.result = result; }
        }

        private final int maxSize;
        private final Deque<Entry> entries = new ArrayDeque<>();

        History(int maxSize){ this.maxSize = maxSize; }

        /** Newest first; the oldest entry is dropped once full. */
        void push(String expr, double result){
            if (maxSize == 0) return;
            if (entries.size() == maxSize) entries.removeLast();
            entries.addFirst(new Entry(expr, result));
        }

        List<Entry> entries(){ return new ArrayList<>(entries); }
        int size(){ return entries.size(); }
    }

    // =========================================================
    // ANSI colors
    // =========================================================
    static final class Ansi {
        static final String GREEN = "\u001B[92m";
        static final String YELLOW = "\u001B[93m";
        static final String DARK_GRAY = "\u001B[90m";
        static final String DARK_GREEN = "\u001B[32m";
        static final String DARK_BLUE = "\u001B[34m";
        static final String RESET = "\u001B[0m";

        private final boolean enabled;
        Ansi(boolean enabled){ this.enabled = enabled; }
        String fg(String code){ return enabled ? code : ""; }
        String reset(){ return enabled ? RESET : ""; }
    }

    // =========================================================
    // Session
    // =========================================================
    static final class Session {
        private final Parser parser;
        private final Environment env;
        private final Config config;
        private final History history;
        private final Ansi ansi;
        private final PrintStream out;

        Session(Parser parser, Environment env, Config config, PrintStream out) {
            this.parser = parser;
            this.env = env;
            this.config = config;
            this.history = new History(config.historySize);
            this.ansi = new Ansi(config.colors);
            this.out = out;
        }

        Environment environment() { return env; }
        History history() { return history; }

        void run(BufferedReader in) throws IOException {
            while (true) {
                out.print(ansi.fg(Ansi.GREEN) + config.prompt + ansi.reset());
                out.flush();
                String line = in.readLine();
                if (line == null || !handle(line)) break;
            }
        }

        /**
         * Handle one input line. Returns false when the session should end.
         */
        boolean handle(String rawLine) {
            String line = Scan.trimWhitespace(rawLine);
            if ("quit".equals(line)) return false;
            if ("vars".equals(line)) {
                for (Map.Entry<String, Double> v : env.variables().entrySet()) {
                    out.println("  " + v.getKey() + " = " + TreePrinter.formatNumber(v.getValue()));
                }
                return true;
            }
            if ("history".equals(line)) {
                int i = 0;
                for (History.Entry e : history.entries()) {
                    out.println(ansi.fg(Ansi.DARK_GRAY) + String.format("%2d. ", i++)
                            + ansi.fg(Ansi.DARK_GREEN) + e.expr
                            + ansi.fg(Ansi.DARK_BLUE) + " = " + TreePrinter.formatNumber(e.result) + ansi.reset());
                }
                return true;
            }
            try {
                if (line.startsWith("tree ")) {
                    Optional<Expr> expr = parser.parse(line.substring("tree ".length()));
                    if (expr.isPresent()) out.print(expr.get().print(1));
                    else out.println("cannot parse expression");
                    return true;
                }
                Optional<Expr> expr = parser.parse(line);
                if (expr.isPresent()) {
                    double res = expr.get().eval(env);
                    env.assign(config.resultVariable, res);
                    history.push(line, res);
                    out.println(ansi.fg(Ansi.YELLOW) + config.resultVariable + " = " + TreePrinter.formatNumber(res) + ansi.reset());
                } else {
                    out.println("cannot parse expression");
                }
            } catch (CalcException e) {
                out.println("exception: " + e.getMessage());
            }
            return true;
        }
    }

    // =========================================================
    // JSON batch
    // =========================================================
    static final class Batch {
        private static final ObjectMapper MAPPER = new ObjectMapper();

        /**
         * Evaluate every expression of the input document in one session and write the results.
         * Input: {"variables": {...}, "expressions": [...]}.
         */
        static void run(Config config, Path input, Path output, PrintStream console) {
            JsonNode doc;
            try {
                doc = MAPPER.readTree(input.toFile());
            } catch (IOException e) {
                throw new InputError("IO_ERROR", "cannot read " + input + " - " + e.getMessage());
            }
            ObjectNode result = evaluate(config, doc, input.toString());
            try {
                if (output == null) {
                    console.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result));
                } else {
                    if (output.getParent() != null) Files.createDirectories(output.getParent());
                    MAPPER.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), result);
                    console.println("Saved " + output);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("cannot write " + output, e);
            }
        }

        static ObjectNode evaluate(Config config, JsonNode doc, String source) {
            if (doc == null || !doc.isObject()) throw new InputError("PARSE_ERROR", source + " must be a JSON object");
            Environment env = newEnvironment(config);
            JsonNode vars = doc.get("variables");
            if (vars != null && vars.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = vars.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> v = it.next();
                    if (!v.getValue().isNumber()) {
                        throw new InputError("PARSE_ERROR", "variable '" + v.getKey() + "' in " + source + " must be numeric");
                    }
                    env.assign(v.getKey(), v.getValue().asDouble());
                }
            }
            JsonNode exprs = doc.get("expressions");
            if (exprs == null || !exprs.isArray()) throw new InputError("PARSE_ERROR", source + " needs an 'expressions' array");

            Parser parser = new Parser();
            ObjectNode out = MAPPER.createObjectNode();
            ArrayNode results = out.putArray("results");
            for (JsonNode e : exprs) {
                String text = e.asText();
                ObjectNode r = results.addObject();
                r.put("expression", text);
                try {
                    Optional<Expr> expr = parser.parse(text);
                    if (expr.isPresent()) {
                        double v = expr.get().eval(env);
                        env.assign(config.resultVariable, v);
                        r.put("value", v);
                    } else {
                        r.put("error", "cannot parse expression");
                    }
                } catch (CalcException ex) {
                    System.err.println("WARNING: '" + text + "' - " + ex.getMessage());
                    r.put("error", ex.getMessage());
                }
            }
            ObjectNode finalVars = out.putObject("variables");
            for (Map.Entry<String, Double> v : env.variables().entrySet()) finalVars.put(v.getKey(), v.getValue());
            return out;
        }
    }
}
