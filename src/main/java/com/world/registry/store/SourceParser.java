package com.world.registry.store;

import com.world.registry.core.model.EntityType;
import com.world.registry.logging.LogContext;
import com.world.registry.temporal.TemporalParser;
import com.world.registry.temporal.TemporalValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns one declaration source into typed, temporally parsed attribute records.
 *
 * <p>Parsing touches no shared state, so several sources can be parsed concurrently;
 * the results are merged in source order by {@link EntityStoreBuilder}.</p>
 */
public class SourceParser {
    private static final Logger log = LoggerFactory.getLogger(SourceParser.class);

    /**
     * Parses every recognized section of the source. Malformed lines become issues, never exceptions.
     */
    public ParsedSource parse(DeclarationSource source) {
        List<ParsedDeclaration> declarations = new ArrayList<>();
        List<StoreIssue> issues = new ArrayList<>();

        try (LogContext ctx = LogContext.forSource(source.sourceId())) {
            for (DeclarationSection section : source.sections()) {
                Optional<EntityType> type = EntityType.fromSectionLabel(section.label());
                if (type.isEmpty()) {
                    log.debug("store.section.skipped sourceId={} label='{}'", source.sourceId(), section.label());
                    continue;
                }
                for (EntityDeclaration declaration : section.entities()) {
                    parseDeclaration(source.sourceId(), type.get(), declaration, issues)
                            .ifPresent(declarations::add);
                }
            }
            log.debug("store.source.parsed sourceId={} declarations={} issues={}",
                    source.sourceId(), declarations.size(), issues.size());
        }
        return new ParsedSource(source.sourceId(), declarations, issues);
    }

    private Optional<ParsedDeclaration> parseDeclaration(String sourceId, EntityType type,
                                                         EntityDeclaration declaration,
                                                         List<StoreIssue> issues) {
        String name = declaration.name().trim();
        if (name.isEmpty()) {
            log.warn("store.declaration.unnamed sourceId={} type={}", sourceId, type);
            issues.add(new StoreIssue(sourceId, null, declaration.name(), "Entity declaration without a name"));
            return Optional.empty();
        }

        List<ParsedAttribute> attributes = new ArrayList<>();
        for (AttributeLine line : declaration.attributes()) {
            String text = line.text();
            int colon = text.indexOf(':');
            if (colon < 0) {
                warn(issues, sourceId, name, text, "Attribute line has no ':' separator");
                continue;
            }
            String tag = text.substring(0, colon).trim();
            if (tag.isEmpty()) {
                warn(issues, sourceId, name, text, "Attribute line has an empty tag");
                continue;
            }
            String rawValue = joinValue(text.substring(colon + 1), line.continuation());
            TemporalValue value = TemporalParser.parse(rawValue);
            if (value.text().isEmpty()) {
                warn(issues, sourceId, name, text, "Attribute '" + tag + "' has an empty value");
                continue;
            }
            attributes.add(new ParsedAttribute(tag, value, text));
        }
        return Optional.of(new ParsedDeclaration(name, type, attributes));
    }

    private static String joinValue(String firstLine, List<String> continuation) {
        if (continuation.isEmpty()) {
            return firstLine.trim();
        }
        StringBuilder sb = new StringBuilder(firstLine.trim());
        for (String next : continuation) {
            if (!sb.isEmpty()) {
                sb.append('\n');
            }
            sb.append(next.trim());
        }
        return sb.toString();
    }

    private static void warn(List<StoreIssue> issues, String sourceId, String entityName, String line, String message) {
        log.warn("store.attribute.malformed sourceId={} entity='{}' line='{}' reason={}",
                sourceId, entityName, line, message);
        issues.add(new StoreIssue(sourceId, entityName, line, message));
    }

    /**
     * A parsed attribute: raw tag, parsed temporal value and the original line for diagnostics.
     */
    public record ParsedAttribute(String tag, TemporalValue value, String line) {}

    /**
     * A parsed entity declaration.
     */
    public record ParsedDeclaration(String name, EntityType type, List<ParsedAttribute> attributes) {
        public ParsedDeclaration {
            attributes = List.copyOf(attributes);
        }
    }

    /**
     * All declarations and issues of one source.
     */
    public record ParsedSource(String sourceId, List<ParsedDeclaration> declarations, List<StoreIssue> issues) {
        public ParsedSource {
            declarations = List.copyOf(declarations);
            issues = List.copyOf(issues);
        }
    }
}
