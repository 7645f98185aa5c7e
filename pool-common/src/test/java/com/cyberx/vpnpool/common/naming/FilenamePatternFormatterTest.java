package com.cyberx.vpnpool.common.naming;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class FilenamePatternFormatterTest {

    private static final Pattern SAFE_NAME = Pattern.compile("^[A-Za-z0-9._\\-{}]*\\.conf$");

    private final FilenamePatternFormatter formatter = new FilenamePatternFormatter();

    private record TestCredential(Long id, String ipv4Address, String endpoint, String requestBatchId)
        implements NamedCredential {
        @Override public Long getId() { return id; }
        @Override public String getIpv4Address() { return ipv4Address; }
        @Override public String getEndpoint() { return endpoint; }
        @Override public String getRequestBatchId() { return requestBatchId; }
    }

    private final TestCredential credential = new TestCredential(
        42L, "10.20.200.149", "216.208.235.11:51020", "3f2c9a1e-7b44-4c1d-9a51-2f0e8d6c1b77");

    @Test
    void testAllPlaceholders() {
        String name = formatter.format(
            "{username}_{user_id}_{id}_{ipv4_address}_{endpoint}_{batch_id}_{index}.conf",
            credential, new Requester(7L, "jdoe"), 3);

        assertEquals("jdoe_7_42_10.20.200.149_216.208.235.11_51020_3f2c9a1e_3.conf", name);
    }

    @Test
    void testDefaultsWithoutRequesterOrIndex() {
        String name = formatter.format("{username}-{user_id}-{index}", credential, null, null);

        assertEquals("unknown-unknown-1.conf", name);
    }

    @Test
    void testUsernameSynthesizedFromUserId() {
        String name = formatter.format("{username}", credential, new Requester(9L, null), 1);

        assertEquals("user9.conf", name);
    }

    @Test
    void testMissingCredentialValuesBecomeUnknown() {
        TestCredential bare = new TestCredential(5L, null, null, null);

        String name = formatter.format("{ipv4_address}_{endpoint}_{batch_id}", bare, null, 1);

        assertEquals("unknown_unknown_unknown.conf", name);
    }

    @Test
    void testUnsafeCharactersReplaced() {
        String name = formatter.format("vpn config/{id} (copy)!.conf", credential, null, 1);

        assertEquals("vpn_config_42__copy__.conf", name);
    }

    @Test
    void testUnknownPlaceholderBracesSurvive() {
        String name = formatter.format("{nope}_{id}", credential, null, 1);

        assertEquals("{nope}_42.conf", name);
    }

    @Test
    void testExtensionNotDuplicated() {
        assertEquals("simnet_10.20.200.149.conf",
            formatter.format("simnet_{ipv4_address}.conf", credential, null, null));
    }

    @Test
    void testOutputAlwaysMatchesSafeNameContract() {
        String[] patterns = {"", "   ", "ünïcødé_{id}", "../../etc/passwd", "{username}", "a:b*c?d", null};
        for (String pattern : patterns) {
            String name = formatter.format(pattern, credential, new Requester(1L, "weird name/é"), 2);
            assertFalse(name.isEmpty());
            assertTrue(SAFE_NAME.matcher(name).matches(), () -> "Unexpected filename: " + name);
        }
    }
}
