package com.world.registry.index;

import com.world.registry.core.model.Entity;
import com.world.registry.core.model.Identity;
import com.world.registry.core.model.IdentityKind;
import com.world.registry.core.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps PLAYER-kind entities onto the external player record they denote.
 *
 * <p>A player entity or player character that shares any name with a {@link Player}
 * is represented by that player, so the two never mark each other ambiguous in the
 * index. The first matching player (in supplied order) wins.</p>
 */
public class IdentityDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(IdentityDeduplicator.class);

    private final Map<Identity, Identity> representatives = new HashMap<>();

    public IdentityDeduplicator(Collection<Entity> entities, List<Player> players) {
        for (Entity entity : entities) {
            if (entity.getKind() != IdentityKind.PLAYER) {
                continue;
            }
            for (Player player : players) {
                if (player.sharesNameWith(entity)) {
                    representatives.put(entity, player);
                    log.debug("index.dedup entity='{}' player='{}'", entity.getName(), player.getName());
                    break;
                }
            }
        }
    }

    /**
     * Returns the identity that owns index keys on behalf of the given one.
     */
    public Identity representativeOf(Identity identity) {
        return representatives.getOrDefault(identity, identity);
    }

    public int mergedCount() {
        return representatives.size();
    }
}
