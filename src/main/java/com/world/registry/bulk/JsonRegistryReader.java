package com.world.registry.bulk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.world.registry.core.model.Player;
import com.world.registry.overlay.ChangeRecord;
import com.world.registry.overlay.TagChange;
import com.world.registry.store.AttributeLine;
import com.world.registry.store.DeclarationSection;
import com.world.registry.store.DeclarationSource;
import com.world.registry.store.EntityDeclaration;
import com.world.registry.temporal.TemporalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the three registry input shapes from JSON arrays.
 *
 * <p>Declaration sources:</p>
 * <pre>
 * [{"sourceId": "base", "sections": [
 *     {"label": "NPC", "entities": [
 *         {"name": "Korm Blackhand", "attributes": ["Location: Steadwick", "Status: Active"]}]}]}]
 * </pre>
 * <p>An attribute string containing line breaks is split into its first line and continuation lines.</p>
 *
 * <p>Players: {@code [{"name": "Sandro", "aliases": ["Sandro the Lich"]}]}</p>
 *
 * <p>Change records:</p>
 * <pre>
 * [{"date": "2026-02-01", "target": "Korm Blackhand", "changes": [{"tag": "Status", "value": "Removed"}]}]
 * </pre>
 */
public class JsonRegistryReader {
    private static final Logger log = LoggerFactory.getLogger(JsonRegistryReader.class);

    private final ObjectMapper objectMapper;

    public JsonRegistryReader() {
        this(new ObjectMapper());
    }

    public JsonRegistryReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<DeclarationSource> readSources(InputStream input) throws IOException {
        return toSources(objectMapper.readValue(input, new TypeReference<List<SourceDto>>() {}));
    }

    public List<DeclarationSource> readSources(Reader reader) throws IOException {
        return toSources(objectMapper.readValue(reader, new TypeReference<List<SourceDto>>() {}));
    }

    public List<Player> readPlayers(InputStream input) throws IOException {
        return toPlayers(objectMapper.readValue(input, new TypeReference<List<PlayerDto>>() {}));
    }

    public List<Player> readPlayers(Reader reader) throws IOException {
        return toPlayers(objectMapper.readValue(reader, new TypeReference<List<PlayerDto>>() {}));
    }

    /**
     * @throws IOException on malformed JSON, or a record whose date cannot be parsed
     */
    public List<ChangeRecord> readChangeRecords(InputStream input) throws IOException {
        return toChangeRecords(objectMapper.readValue(input, new TypeReference<List<ChangeRecordDto>>() {}));
    }

    public List<ChangeRecord> readChangeRecords(Reader reader) throws IOException {
        return toChangeRecords(objectMapper.readValue(reader, new TypeReference<List<ChangeRecordDto>>() {}));
    }

    private List<DeclarationSource> toSources(List<SourceDto> dtos) throws IOException {
        List<DeclarationSource> sources = new ArrayList<>();
        for (SourceDto dto : nullToEmpty(dtos)) {
            if (dto.sourceId() == null) {
                throw new IOException("Declaration source without sourceId");
            }
            List<DeclarationSection> sections = new ArrayList<>();
            for (SectionDto section : nullToEmpty(dto.sections())) {
                if (section.label() == null) {
                    throw new IOException("Section without label in source '" + dto.sourceId() + "'");
                }
                List<EntityDeclaration> entities = new ArrayList<>();
                for (EntityDto entity : nullToEmpty(section.entities())) {
                    if (entity.name() == null) {
                        throw new IOException("Entity without name in source '" + dto.sourceId() + "'");
                    }
                    entities.add(new EntityDeclaration(entity.name(),
                            nullToEmpty(entity.attributes()).stream().map(this::toAttributeLine).toList()));
                }
                sections.add(new DeclarationSection(section.label(), entities));
            }
            sources.add(new DeclarationSource(dto.sourceId(), sections));
        }
        log.info("bulk.sources.read sources={}", sources.size());
        return sources;
    }

    private AttributeLine toAttributeLine(String raw) {
        String[] lines = raw.split("\\R");
        if (lines.length == 1) {
            return AttributeLine.of(raw);
        }
        return new AttributeLine(lines[0], Arrays.asList(lines).subList(1, lines.length));
    }

    private List<Player> toPlayers(List<PlayerDto> dtos) throws IOException {
        List<Player> players = new ArrayList<>();
        for (PlayerDto dto : nullToEmpty(dtos)) {
            if (dto.name() == null) {
                throw new IOException("Player without name");
            }
            players.add(new Player(dto.name(), nullToEmpty(dto.aliases())));
        }
        log.info("bulk.players.read players={}", players.size());
        return players;
    }

    private List<ChangeRecord> toChangeRecords(List<ChangeRecordDto> dtos) throws IOException {
        List<ChangeRecord> records = new ArrayList<>();
        for (ChangeRecordDto dto : nullToEmpty(dtos)) {
            if (dto.target() == null) {
                throw new IOException("Change record without target");
            }
            Instant date = dto.date() == null ? null : TemporalParser.parseStartBound(dto.date());
            if (date == null) {
                throw new IOException("Change record for '" + dto.target() + "' has invalid date '" + dto.date() + "'");
            }
            List<TagChange> changes = new ArrayList<>();
            for (TagChangeDto change : nullToEmpty(dto.changes())) {
                if (change.tag() == null || change.tag().isBlank() || change.value() == null) {
                    log.warn("bulk.change.incomplete target='{}' tag='{}'", dto.target(), change.tag());
                    continue;
                }
                changes.add(new TagChange(change.tag(), change.value()));
            }
            records.add(new ChangeRecord(date, dto.target(), changes));
        }
        log.info("bulk.changes.read records={}", records.size());
        return records;
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values != null ? values : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SourceDto(String sourceId, List<SectionDto> sections) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SectionDto(String label, List<EntityDto> entities) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EntityDto(String name, List<String> attributes) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PlayerDto(String name, List<String> aliases) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChangeRecordDto(String date, String target, List<TagChangeDto> changes) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TagChangeDto(String tag, String value) {}
}
