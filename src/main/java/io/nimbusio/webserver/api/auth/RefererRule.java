package io.nimbusio.webserver.api.auth;

import com.google.common.base.Preconditions;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A rule matching requests by the host of their Referer header. The pattern is a glob where {@code *} matches any run
 * of characters, compared case-insensitively, e.g. {@code *.example.com}.
 */
public final class RefererRule extends AccessRule {

    private final String glob;
    private final Pattern pattern;

    public RefererRule(String glob, RuleEffect effect, Set<AccessLevel> levels) {
        super(effect, levels);
        Preconditions.checkArgument(!glob.isEmpty(), "referer pattern must not be empty");
        this.glob = glob;
        this.pattern = compile(glob);
    }

    public boolean matches(String refererHost) {
        return pattern.matcher(refererHost.toLowerCase(Locale.ROOT)).matches();
    }

    private static Pattern compile(String glob) {
        final StringBuilder regex = new StringBuilder();
        final String[] parts = glob.toLowerCase(Locale.ROOT).split("\\*", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            if (!parts[i].isEmpty()) {
                regex.append(Pattern.quote(parts[i]));
            }
        }
        return Pattern.compile(regex.toString());
    }

    @Override
    public String toString() {
        return "referer " + glob + " " + getEffect() + " " + getLevels();
    }
}
