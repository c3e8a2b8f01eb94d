package work.lcod.chartlint.recursion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Recurses into the manifests stored under each key of a rendered ConfigMap.
 */
public final class ConfigMapExtraction implements ExtractionFunction {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final String manifestPath;

    private ConfigMapExtraction(String manifestPath) {
        this.manifestPath = manifestPath;
    }

    /**
     * @param manifestPath the ConfigMap file, relative to the rendered output directory
     *                     (e.g. {@code mychart/templates/configmap.yaml})
     */
    public static ConfigMapExtraction of(String manifestPath) {
        if (manifestPath == null || manifestPath.isBlank()) {
            throw new IllegalArgumentException("manifestPath is required");
        }
        return new ConfigMapExtraction(manifestPath);
    }

    @Override
    public void extract(Path renderedDir, Path targetDir) throws IOException {
        Path manifest = renderedDir.resolve(manifestPath);
        JsonNode root = YAML_MAPPER.readTree(Files.readString(manifest, StandardCharsets.UTF_8));
        if (root == null || !root.hasNonNull("data")) {
            return;
        }
        JsonNode data = root.get("data");
        if (!data.isObject()) {
            throw new IOException("ConfigMap data must be a mapping: " + manifest);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            Path target = targetDir.resolve(fileNameFor(entry.getKey())).normalize();
            if (!target.startsWith(targetDir.normalize())) {
                throw new IOException("Refusing to write ConfigMap key outside target directory: " + entry.getKey());
            }
            Files.createDirectories(target.getParent());
            Files.writeString(target, entry.getValue().asText(), StandardCharsets.UTF_8);
        }
    }

    static String fileNameFor(String key) {
        return key.endsWith(".yaml") ? key : key + ".yaml";
    }

    @Override
    public String toString() {
        return "configmap:" + manifestPath;
    }
}
