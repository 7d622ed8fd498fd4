package io.nimbusio.webserver.api.auth;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;

import java.util.EnumSet;
import java.util.Set;

/**
 * Common part of the rules in an access control policy: the effect of the rule and the access levels it covers.
 */
public abstract class AccessRule {

    private final RuleEffect effect;
    private final Set<AccessLevel> levels;

    protected AccessRule(RuleEffect effect, Set<AccessLevel> levels) {
        Preconditions.checkArgument(!levels.contains(AccessLevel.NO_ACCESS), "rules cannot cover NO_ACCESS");
        this.effect = Preconditions.checkNotNull(effect);
        this.levels = levels.isEmpty()
                ? Sets.immutableEnumSet(EnumSet.complementOf(EnumSet.of(AccessLevel.NO_ACCESS)))
                : Sets.immutableEnumSet(levels);
    }

    public RuleEffect getEffect() {
        return effect;
    }

    public Set<AccessLevel> getLevels() {
        return levels;
    }

    public boolean appliesTo(AccessLevel level) {
        return levels.contains(level);
    }
}
