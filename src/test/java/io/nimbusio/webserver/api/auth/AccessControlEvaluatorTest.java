package io.nimbusio.webserver.api.auth;

import com.google.common.net.InetAddresses;
import io.nimbusio.webserver.util.ObjectMappers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;

/**
 * Tests for the evaluation order of access control rules.
 */
class AccessControlEvaluatorTest {

    private static final InetAddress INSIDE = InetAddresses.forString("10.1.2.3");
    private static final InetAddress OUTSIDE = InetAddresses.forString("192.0.2.1");

    private final AccessControlParser parser = new AccessControlParser(ObjectMappers.createApiObjectMapper());
    private final AccessControlEvaluator evaluator = new AccessControlEvaluator();

    private AccessDecision evaluate(AccessLevel level, String document, InetAddress from, String referer, String path) {
        return evaluator.evaluate(level, parser.parse(document), new AccessRequestContext(from, referer, path));
    }

    @Test
    void noAccessIsAlwaysGranted() {
        final AccessDecision decision = evaluate(AccessLevel.NO_ACCESS,
                "{\"ip_rules\": [{\"cidr\": \"0.0.0.0/0\", \"effect\": \"deny\"}]}", OUTSIDE, null, "/ping");
        Assertions.assertTrue(decision.isGranted());
    }

    @Test
    void defaultPolicyRequiresCredentials() {
        Assertions.assertTrue(evaluate(AccessLevel.READ, null, INSIDE, null, "/data/a").isRequiresSecondaryAuth());
    }

    @Test
    void firstMatchingIpRuleWins() {
        final String document = "{\"ip_rules\": ["
                + "{\"cidr\": \"10.1.0.0/16\", \"effect\": \"deny\"},"
                + "{\"cidr\": \"10.0.0.0/8\", \"effect\": \"allow\"}]}";
        Assertions.assertEquals(AccessDecision.Outcome.FORBIDDEN,
                evaluate(AccessLevel.READ, document, INSIDE, null, "/data/a").getOutcome());
        Assertions.assertTrue(
                evaluate(AccessLevel.READ, document, InetAddresses.forString("10.9.0.1"), null, "/data/a").isGranted());
    }

    @Test
    void rulesOnlyApplyToTheirLevels() {
        final String document = "{\"password_required\": false, \"ip_rules\": "
                + "[{\"cidr\": \"10.0.0.0/8\", \"effect\": \"allow\", \"levels\": [\"read\"]}]}";
        Assertions.assertTrue(evaluate(AccessLevel.READ, document, INSIDE, null, "/data/a").isGranted());
        Assertions.assertEquals(AccessDecision.Outcome.FORBIDDEN,
                evaluate(AccessLevel.WRITE, document, INSIDE, null, "/data/a").getOutcome());
    }

    @Test
    void ipRulesComeBeforeRefererRules() {
        final String document = "{"
                + "\"ip_rules\": [{\"cidr\": \"10.0.0.0/8\", \"effect\": \"deny\"}],"
                + "\"referer_rules\": [{\"pattern\": \"*.example.com\", \"effect\": \"allow\"}]}";
        Assertions.assertFalse(evaluate(AccessLevel.READ, document, INSIDE, "www.example.com", "/data/a").isGranted());
        Assertions.assertTrue(evaluate(AccessLevel.READ, document, OUTSIDE, "www.example.com", "/data/a").isGranted());
    }

    @Test
    void refererRulesAreSkippedWithoutAReferer() {
        final String document = "{\"password_required\": false,"
                + "\"referer_rules\": [{\"pattern\": \"*\", \"effect\": \"allow\"}]}";
        Assertions.assertTrue(evaluate(AccessLevel.READ, document, OUTSIDE, "anything.org", "/data/a").isGranted());
        Assertions.assertEquals(AccessDecision.Outcome.FORBIDDEN,
                evaluate(AccessLevel.READ, document, OUTSIDE, null, "/data/a").getOutcome());
    }

    @Test
    void passwordEffectRequiresCredentials() {
        final String document = "{\"ip_rules\": [{\"cidr\": \"10.0.0.0/8\", \"effect\": \"password\"}]}";
        Assertions.assertTrue(evaluate(AccessLevel.READ, document, INSIDE, null, "/data/a").isRequiresSecondaryAuth());
    }

    @Test
    void locationPolicyReplacesTheCollectionPolicy() {
        final String document = "{"
                + "\"ip_rules\": [{\"cidr\": \"0.0.0.0/0\", \"effect\": \"deny\"}],"
                + "\"locations\": [{\"prefix\": \"/data/public/\", \"access_control\": "
                + "{\"ip_rules\": [{\"cidr\": \"0.0.0.0/0\", \"effect\": \"allow\"}]}}]}";
        Assertions.assertTrue(evaluate(AccessLevel.READ, document, OUTSIDE, null, "/data/public/a").isGranted());
        Assertions.assertFalse(evaluate(AccessLevel.READ, document, OUTSIDE, null, "/data/private/a").isGranted());
    }
}
