// file: client/src/test/java/io/admitq/client/CliTest.java
package io.admitq.client;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @Test
    void base_url_defaults_when_flag_absent() {
        Map.Entry<String, String[]> parsed = Cli.parseBaseUrl(new String[]{"summary", "org-1"});

        assertEquals(Cli.DEFAULT_BASE_URL, parsed.getKey());
        assertArrayEquals(new String[]{"summary", "org-1"}, parsed.getValue());
    }

    @Test
    void base_url_flag_is_stripped_from_command() {
        Map.Entry<String, String[]> parsed =
                Cli.parseBaseUrl(new String[]{"--base-url", "http://q:9000", "sweep"});

        assertEquals("http://q:9000", parsed.getKey());
        assertArrayEquals(new String[]{"sweep"}, parsed.getValue());
    }

    @Test
    void base_url_flag_without_value_is_rejected() {
        assertThrows(Cli.CliException.class, () -> Cli.parseBaseUrl(new String[]{"--base-url"}));
    }

    @Test
    void scope_kind_maps_to_query_param() {
        assertEquals("orgId", Cli.scopeParam("org"));
        assertEquals("agentId", Cli.scopeParam("agent"));
        assertThrows(Cli.CliException.class, () -> Cli.scopeParam("tenant"));
    }
}
