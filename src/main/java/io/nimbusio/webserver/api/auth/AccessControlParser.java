package io.nimbusio.webserver.api.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses the access control document stored with a collection.
 *
 * <pre>
 * {
 *     "ip_rules": [{"cidr": "10.0.0.0/8", "effect": "allow", "levels": ["read", "list"]}],
 *     "referer_rules": [{"pattern": "*.example.com", "effect": "allow", "levels": ["read"]}],
 *     "password_required": true,
 *     "locations": [{"prefix": "/data/public/", "access_control": { ... }}]
 * }
 * </pre>
 *
 * Every member is optional. A rule without "levels" covers every level; "password_required" defaults to true.
 */
public final class AccessControlParser {

    private static final String IP_RULES = "ip_rules";
    private static final String REFERER_RULES = "referer_rules";
    private static final String PASSWORD_REQUIRED = "password_required";
    private static final String LOCATIONS = "locations";
    private static final String ACCESS_CONTROL = "access_control";

    private final ObjectMapper mapper;

    public AccessControlParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws InvalidAccessControlException if the document is not valid
     */
    public AccessControlPolicy parse(String document) {
        if (StringUtils.isBlank(document)) {
            return AccessControlPolicy.DEFAULT;
        }
        final JsonNode root;
        try {
            root = mapper.readTree(document);
        } catch (IOException e) {
            throw new InvalidAccessControlException("Access control is not valid JSON", e);
        }
        return parsePolicy(root, true);
    }

    private AccessControlPolicy parsePolicy(JsonNode node, boolean allowLocations) {
        if (node == null || node.isNull()) {
            return AccessControlPolicy.DEFAULT;
        }
        requireObject(node, "access control");
        checkMembers(node, IP_RULES, REFERER_RULES, PASSWORD_REQUIRED, LOCATIONS);

        final ImmutableList.Builder<IpRule> ipRules = ImmutableList.builder();
        for (JsonNode rule : array(node, IP_RULES)) {
            requireObject(rule, IP_RULES);
            checkMembers(rule, "cidr", "effect", "levels");
            final CidrBlock cidr;
            try {
                cidr = CidrBlock.parse(text(rule, "cidr"));
            } catch (IllegalArgumentException e) {
                throw new InvalidAccessControlException("Invalid cidr in ip rule: " + rule, e);
            }
            ipRules.add(new IpRule(cidr, RuleEffect.fromDocumentName(text(rule, "effect")), levels(rule)));
        }

        final ImmutableList.Builder<RefererRule> refererRules = ImmutableList.builder();
        for (JsonNode rule : array(node, REFERER_RULES)) {
            requireObject(rule, REFERER_RULES);
            checkMembers(rule, "pattern", "effect", "levels");
            refererRules.add(new RefererRule(
                    text(rule, "pattern"), RuleEffect.fromDocumentName(text(rule, "effect")), levels(rule)));
        }

        boolean passwordRequired = true;
        final JsonNode password = node.get(PASSWORD_REQUIRED);
        if (password != null) {
            if (!password.isBoolean()) {
                throw new InvalidAccessControlException(PASSWORD_REQUIRED + " must be a boolean");
            }
            passwordRequired = password.booleanValue();
        }

        final ImmutableList.Builder<Map.Entry<String, AccessControlPolicy>> locations = ImmutableList.builder();
        final List<JsonNode> locationNodes = array(node, LOCATIONS);
        if (!allowLocations && !locationNodes.isEmpty()) {
            throw new InvalidAccessControlException("Location policies cannot be nested");
        }
        for (JsonNode location : locationNodes) {
            requireObject(location, LOCATIONS);
            checkMembers(location, "prefix", ACCESS_CONTROL);
            locations.add(Maps.immutableEntry(text(location, "prefix"),
                    parsePolicy(location.get(ACCESS_CONTROL), false)));
        }

        return new AccessControlPolicy(ipRules.build(), refererRules.build(), passwordRequired, locations.build());
    }

    private static Set<AccessLevel> levels(JsonNode rule) {
        final Set<AccessLevel> levels = EnumSet.noneOf(AccessLevel.class);
        for (JsonNode level : array(rule, "levels")) {
            if (!level.isTextual()) {
                throw new InvalidAccessControlException("Access levels must be strings: " + rule);
            }
            final AccessLevel parsed = AccessLevel.fromDocumentName(level.textValue());
            if (parsed == AccessLevel.NO_ACCESS) {
                throw new InvalidAccessControlException("Rules cannot name no_access: " + rule);
            }
            levels.add(parsed);
        }
        return levels;
    }

    private static List<JsonNode> array(JsonNode node, String member) {
        final JsonNode value = node.get(member);
        if (value == null || value.isNull()) {
            return ImmutableList.of();
        }
        if (!value.isArray()) {
            throw new InvalidAccessControlException(member + " must be an array");
        }
        return ImmutableList.copyOf(value);
    }

    private static String text(JsonNode node, String member) {
        final JsonNode value = node.get(member);
        if (value == null || !value.isTextual()) {
            throw new InvalidAccessControlException("Missing or non-string \"" + member + "\" in " + node);
        }
        return value.textValue();
    }

    private static void requireObject(JsonNode node, String what) {
        if (!node.isObject()) {
            throw new InvalidAccessControlException(what + " entries must be JSON objects");
        }
    }

    private static void checkMembers(JsonNode node, String... allowed) {
        final Set<String> names = ImmutableSet.copyOf(allowed);
        final Iterator<String> fields = node.fieldNames();
        while (fields.hasNext()) {
            final String field = fields.next();
            if (!names.contains(field)) {
                throw new InvalidAccessControlException("Unknown access control member \"" + field + "\"");
            }
        }
    }
}
