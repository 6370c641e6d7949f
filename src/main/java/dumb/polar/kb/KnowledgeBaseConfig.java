package dumb.polar.kb;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.polar.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Knowledge base setup read from JSON, e.g. {@code {"scopes": ["authz", "billing"]}}.
 * {@code default} is always present whether listed or not.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KnowledgeBaseConfig(@JsonProperty("scopes") List<String> scopes) {
    public static final KnowledgeBaseConfig DEFAULT = new KnowledgeBaseConfig(List.of());
    private static final Logger logger = LoggerFactory.getLogger(KnowledgeBaseConfig.class);

    @JsonCreator
    public KnowledgeBaseConfig(@JsonProperty("scopes") @Nullable List<String> scopes) {
        this.scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public static KnowledgeBaseConfig parse(String json) {
        try {
            return log(Json.obj(json, KnowledgeBaseConfig.class));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Invalid knowledge base config: " + e.getOriginalMessage(), e);
        }
    }

    public static KnowledgeBaseConfig load(InputStream in) {
        try {
            return log(Json.the.readValue(in, KnowledgeBaseConfig.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read knowledge base config", e);
        }
    }

    private static KnowledgeBaseConfig log(KnowledgeBaseConfig c) {
        logger.info("Loaded knowledge base config: scopes={}", c.scopes);
        return c;
    }
}
