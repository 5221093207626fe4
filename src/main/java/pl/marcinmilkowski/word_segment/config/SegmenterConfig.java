package pl.marcinmilkowski.word_segment.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_segment.lexicon.FrequencyLexicon;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Loads segmenter configuration from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "dictionary": "dict.txt",
 *   "user_dictionaries": ["user.txt", ...],
 *   "emission_table": "prob_emit.json",
 *   "hmm": true,
 *   "load_batch_size": 10000
 * }
 *
 * Relative paths are resolved against the directory holding the config file.
 */
public class SegmenterConfig {
    private static final Logger logger = LoggerFactory.getLogger(SegmenterConfig.class);

    private final String version;
    private final Path configPath;
    private final Path dictionaryPath;
    private final List<Path> userDictionaryPaths;
    private final Path emissionTablePath;
    private final boolean hmmEnabled;
    private final int loadBatchSize;

    /**
     * Load configuration from the specified path.
     *
     * @param configPath Path to the JSON config file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public SegmenterConfig(Path configPath) throws IOException {
        this.configPath = configPath;

        if (!Files.exists(configPath)) {
            throw new IOException("Segmenter config file not found: " + configPath);
        }

        JSONObject root = JSON.parseObject(Files.readString(configPath, StandardCharsets.UTF_8));
        if (root == null) {
            throw new IllegalArgumentException("Empty segmenter config: " + configPath);
        }
        Path baseDir = configPath.toAbsolutePath().getParent();

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in segmenter config");
        }
        this.version = parsedVersion;

        this.dictionaryPath = resolve(baseDir, requireString(root, "dictionary"));
        this.emissionTablePath = resolve(baseDir, requireString(root, "emission_table"));

        List<Path> userDictionaries = new ArrayList<>();
        JSONArray userArray = root.getJSONArray("user_dictionaries");
        if (userArray != null) {
            for (int i = 0; i < userArray.size(); i++) {
                String entry = userArray.getString(i);
                if (entry == null || entry.isBlank()) {
                    throw new IllegalArgumentException("Blank user dictionary at index " + i);
                }
                userDictionaries.add(resolve(baseDir, entry));
            }
        }
        this.userDictionaryPaths = Collections.unmodifiableList(userDictionaries);

        Boolean hmm = root.getBoolean("hmm");
        this.hmmEnabled = hmm == null || hmm;

        this.loadBatchSize = root.getIntValue("load_batch_size", FrequencyLexicon.DEFAULT_BATCH_SIZE);
        if (loadBatchSize <= 0) {
            throw new IllegalArgumentException("'load_batch_size' must be positive, got " + loadBatchSize);
        }

        logger.info("Loaded segmenter config version {}: dictionary {}, {} user dictionaries, hmm={} from {}",
            version, dictionaryPath, userDictionaryPaths.size(), hmmEnabled, configPath);
    }

    private static String requireString(JSONObject root, String field) {
        String value = root.getString(field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing '" + field + "' field in segmenter config");
        }
        return value;
    }

    private static Path resolve(Path baseDir, String value) {
        Path path = Path.of(value);
        if (path.isAbsolute() || baseDir == null) {
            return path;
        }
        return baseDir.resolve(path).normalize();
    }

    public String getVersion() {
        return version;
    }

    public Path getConfigPath() {
        return configPath;
    }

    public Path getDictionaryPath() {
        return dictionaryPath;
    }

    /**
     * User dictionaries, in load order.
     */
    public List<Path> getUserDictionaryPaths() {
        return userDictionaryPaths;
    }

    public Path getEmissionTablePath() {
        return emissionTablePath;
    }

    /**
     * Whether accurate mode should use the HMM for unknown runs by default.
     */
    public boolean isHmmEnabled() {
        return hmmEnabled;
    }

    public int getLoadBatchSize() {
        return loadBatchSize;
    }

    /**
     * Export the loaded config as a JSONObject.
     */
    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("version", version);
        root.put("config_path", configPath.toString());
        root.put("dictionary", dictionaryPath.toString());
        JSONArray users = new JSONArray();
        for (Path p : userDictionaryPaths) {
            users.add(p.toString());
        }
        root.put("user_dictionaries", users);
        root.put("emission_table", emissionTablePath.toString());
        root.put("hmm", hmmEnabled);
        root.put("load_batch_size", loadBatchSize);
        return root;
    }
}
