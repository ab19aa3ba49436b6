package com.qaradar.core.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.qaradar.core.model.DiscoveryBrief;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

import static com.qaradar.core.service.export.ReportNaming.*;

/**
 * 브리프 JSON 직렬화.
 * 키는 snake_case (origin, discovery_health, archetype, pages[], fetch_errors[], timestamp ...),
 * enum은 라벨("Brand Credibility", "Moderate" 등), 시간은 ISO-8601.
 */
public class JsonBriefExporter implements BriefExporter {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    @Override
    public Path export(Path baseDir, DiscoveryBrief brief) throws IOException {
        Objects.requireNonNull(brief, "brief");
        var ctx = context(baseDir, brief.getOrigin().toString(), brief.getTimestamp());
        Files.createDirectories(briefsDir(ctx));
        Path outFile = jsonPath(ctx);

        Files.writeString(outFile, toJson(brief), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return outFile;
    }

    public String toJson(DiscoveryBrief brief) throws JsonProcessingException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(brief);
    }
}
