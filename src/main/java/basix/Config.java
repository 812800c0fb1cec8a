package basix;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Logger;

/**
 * Settings of the transformations, read from an ini like file with {@code key = value} lines.
 * <p/>
 * The file is {@value #CONFIG_FILE} in the working directory, the system property
 * {@value #CONFIG_FILE_PROPERTY} can name another one. Missing keys keep their default value.
 */
public class Config {

    public static final String CONFIG_FILE = "basix.ini";

    public static final String CONFIG_FILE_PROPERTY = "basix.config";

    private static final Logger LOG = Logger.getLogger("Config");

    /**
     * How the variable for the tautology or contradiction that replaces a constant is chosen
     */
    public enum WitnessChoice {
        /** first variable of the formula, pre-order and left to right */
        FIRST,
        /** lexicographically smallest variable of the formula */
        LEAST;

        static WitnessChoice parse(String value) {
            for (WitnessChoice choice : values()) {
                if (choice.name().equalsIgnoreCase(value.trim())) {
                    return choice;
                }
            }
            throw new BasixException(String.format("Unknown witness choice \"%s\"", value));
        }
    }

    private static final Map<String, String> defaults = new HashMap<String, String>(){{
        put("defaultVariable", "p");
        put("witnessChoice", "first");
    }};

    private final Map<String, String> config;

    Config(Map<String, String> values) {
        config = new HashMap<>(defaults);
        values.forEach((key, value) -> {
            if (config.containsKey(key)) {
                config.put(key, value.trim());
            } else {
                LOG.warning("Unknown config key \"" + key + "\"");
            }
        });
        defaultVariable();
        witnessChoice();
    }

    /** Variable used when a constant has to be eliminated in a formula without variables */
    public String defaultVariable() {
        String variable = config.get("defaultVariable");
        if (!Syntax.isVariable(variable)) {
            throw new BasixException(String.format("Default variable \"%s\" is not a variable name", variable));
        }
        return variable;
    }

    public WitnessChoice witnessChoice() {
        return WitnessChoice.parse(config.get("witnessChoice"));
    }

    public static Config defaults() {
        return new Config(Collections.emptyMap());
    }

    /**
     * Parse the {@code key = value} lines of the reader, other lines are ignored
     */
    public static Config parse(Reader reader) throws IOException {
        Map<String, String> values = new HashMap<>();
        BufferedReader bufferedReader = new BufferedReader(reader);
        String line;
        while ((line = bufferedReader.readLine()) != null) {
            if (line.contains(" = ")) {
                String[] parts = line.split(" = ", 2);
                values.put(parts[0].trim(), parts[1]);
            }
        }
        return new Config(values);
    }

    /**
     * Load the config file if it exists, an unreadable file results in the default settings
     */
    public static Config load() {
        File file = new File(System.getProperty(CONFIG_FILE_PROPERTY, CONFIG_FILE));
        if (!file.exists()) {
            return defaults();
        }
        try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            LOG.warning(String.format("Cannot read %s, using the defaults: %s", file, e.getMessage()));
            return defaults();
        }
    }

    private static Config instance;

    public static synchronized Config get() {
        if (instance == null) {
            instance = load();
        }
        return instance;
    }
}
