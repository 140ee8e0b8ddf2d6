package com.entigraph.service.core.config.init;

import com.entigraph.service.core.model.config.RuleSetConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

/**
 * Reads rule set documents from a classpath or file location. Files are processed in file name
 * order, which is also the rule-set priority order.
 */
public class ResourceRuleSource {

    private static final Logger log = LoggerFactory.getLogger(ResourceRuleSource.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();

    private final String baseLocation; // e.g. "classpath:/entity-rules/"

    public ResourceRuleSource(String baseLocation) {
        this.baseLocation = baseLocation.endsWith("/") ? baseLocation : baseLocation + "/";
    }

    public List<LoadedRuleFile> load() throws IOException {
        PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
        String ymlPattern = baseLocation + "**/*.yml";
        String yamlPattern = baseLocation + "**/*.yaml";
        String jsonPattern = baseLocation + "**/*.json";

        Resource[] yml = resolver.getResources(ymlPattern);
        Resource[] yaml = resolver.getResources(yamlPattern);
        Resource[] json = resolver.getResources(jsonPattern);
        log.debug(
                "ResourceRuleSource scanning: base={}, counts=[yml={}, yaml={}, json={}]",
                baseLocation,
                yml.length,
                yaml.length,
                json.length);

        List<Resource> resources = Stream.of(yml, yaml, json)
                .flatMap(Arrays::stream)
                .filter(r -> r.exists() && r.isReadable())
                .sorted(Comparator.comparing(ResourceRuleSource::safeName))
                .toList();

        List<LoadedRuleFile> out = new ArrayList<>();
        for (Resource r : resources) {
            String fname = safeName(r);
            String text;
            try (InputStream in = r.getInputStream()) {
                text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            List<RuleSetConfig> parsed = parse(text, fname);
            log.info("Rule files: parsed {} rule set(s) from {}", parsed.size(), fname);
            out.add(new LoadedRuleFile(fname, text, parsed));
        }
        return out;
    }

    /** Flattens the rule sets of all files, keeping file order and declaration order. */
    public static List<RuleSetConfig> ruleSets(List<LoadedRuleFile> files) {
        Map<String, RuleSetConfig> byName = new LinkedHashMap<>();
        List<RuleSetConfig> unnamed = new ArrayList<>();
        for (LoadedRuleFile file : files) {
            for (RuleSetConfig ruleSet : file.ruleSets()) {
                if (ruleSet.ruleSet() == null || ruleSet.ruleSet().isBlank()) {
                    unnamed.add(ruleSet);
                } else if (byName.putIfAbsent(ruleSet.ruleSet().trim(), ruleSet) != null) {
                    throw new IllegalStateException(
                            "Rule set '" + ruleSet.ruleSet().trim() + "' declared twice (second in " + file.name() + ")");
                }
            }
        }
        List<RuleSetConfig> all = new ArrayList<>(byName.values());
        all.addAll(unnamed);
        return all;
    }

    static List<RuleSetConfig> parse(String text, String fileNameHint) throws IOException {
        if (text == null || text.isBlank()) return List.of();
        ObjectMapper mapper = chooseMapper(fileNameHint);
        JsonNode root = mapper.readTree(text);
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        if (root.isObject() && root.has("ruleSets")) {
            List<RuleSetConfig> wrapped =
                    mapper.convertValue(root.get("ruleSets"), new TypeReference<List<RuleSetConfig>>() {});
            return wrapped == null ? List.of() : wrapped;
        }
        if (root.isArray()) {
            return mapper.convertValue(root, new TypeReference<List<RuleSetConfig>>() {});
        }
        return List.of(mapper.treeToValue(root, RuleSetConfig.class));
    }

    private static ObjectMapper chooseMapper(String fileNameHint) {
        String n = Optional.ofNullable(fileNameHint).orElse("").toLowerCase(Locale.ROOT);
        return n.endsWith(".json") ? JSON : YAML;
    }

    private static String safeName(Resource r) {
        String name = r.getFilename();
        return name == null ? "<unknown>" : name;
    }

    public record LoadedRuleFile(String name, String content, List<RuleSetConfig> ruleSets) {}
}
