package com.world.registry.store;

import com.world.registry.core.model.Entity;
import com.world.registry.core.model.EntityStatus;
import com.world.registry.temporal.TimeScoped;

import java.util.Optional;

/**
 * Appends one parsed attribute value to the matching history of an entity.
 * Shared by the store merge and the event overlay so both follow the same tag rules.
 */
public class AttributeApplier {

    /**
     * Applies a value to the entity.
     *
     * @param entity target entity
     * @param tag    raw tag as written
     * @param value  time-scoped value text
     * @throws MalformedAttributeException if the value is empty or not valid for the tag
     */
    public void apply(Entity entity, String tag, TimeScoped<String> value) {
        String text = value.value().trim();
        if (text.isEmpty()) {
            throw new MalformedAttributeException("Empty value for tag '" + tag + "'");
        }
        TimeScoped<String> trimmed = value.map(String::trim);

        Optional<AttributeKey> key = AttributeKey.fromTag(tag);
        if (key.isEmpty()) {
            entity.addOverride(tag, trimmed);
            return;
        }

        switch (key.get()) {
            case LOCATION -> entity.addLocation(trimmed);
            case ACCESS_LINK -> entity.addAccessLink(trimmed);
            case TYPE_OVERRIDE -> entity.addTypeOverride(trimmed);
            case OWNER -> entity.addOwner(trimmed);
            case GROUP -> entity.addGroup(trimmed);
            case ALIAS -> entity.addAlias(trimmed);
            case GENERIC_NAME -> entity.addGenericName(text);
            case CONTAINS -> entity.addContains(text);
            case STATUS -> entity.addStatus(trimmed.map(this::parseStatus));
            case QUANTITY -> entity.addQuantity(trimmed.map(this::parseQuantity));
        }
    }

    private EntityStatus parseStatus(String text) {
        return EntityStatus.parse(text)
                .orElseThrow(() -> new MalformedAttributeException("Unknown status '" + text + "'"));
    }

    private Integer parseQuantity(String text) {
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException e) {
            throw new MalformedAttributeException("Quantity is not an integer: '" + text + "'");
        }
    }
}
