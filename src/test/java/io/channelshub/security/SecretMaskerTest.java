package io.channelshub.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.channelshub.util.Jsons;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SecretMaskerTest {
    @Test
    void credentialFieldsShouldBeMaskedAtAnyDepth() {
        ObjectNode auth = Jsons.mapper().createObjectNode();
        auth.put("type", "key");
        auth.put("key_path", "/home/me/.ssh/id_ed25519");
        auth.put("passphrase", "hunter2");
        ObjectNode host = Jsons.mapper().createObjectNode();
        host.put("name", "db");
        host.put("port", 22);
        host.put("password", "s3cret");
        host.set("auth", auth);
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.set("hosts", Jsons.mapper().createArrayNode().add(host));

        JsonNode masked = SecretMasker.masked(root);

        JsonNode maskedHost = masked.get("hosts").get(0);
        assertEquals(SecretMasker.MASK, maskedHost.get("password").asText());
        assertEquals(SecretMasker.MASK, maskedHost.get("auth").get("passphrase").asText());
        assertEquals("/home/me/.ssh/id_ed25519", maskedHost.get("auth").get("key_path").asText());
        assertEquals(22, maskedHost.get("port").asInt());
        assertEquals("s3cret", root.get("hosts").get(0).get("password").asText());
    }

    @Test
    void nullAndContainerValuesShouldNotBeReplaced() {
        JsonNode masked = SecretMasker.masked((Object) Map.of(
                "token", List.of("a", "b"),
                "passwd", Map.of("inner", "visible")));

        assertTrue(masked.get("token").isArray());
        assertEquals("visible", masked.get("passwd").get("inner").asText());

        ObjectNode withNull = Jsons.mapper().createObjectNode();
        withNull.putNull("secret");
        assertTrue(SecretMasker.masked(withNull).get("secret").isNull());
    }

    @Test
    void sensitiveKeyMatchingShouldIgnoreCase() {
        assertTrue(SecretMasker.isSensitiveKey("DB_PASSWORD"));
        assertTrue(SecretMasker.isSensitiveKey("apiToken"));
        assertTrue(SecretMasker.isSensitiveKey("Credentials"));
        assertFalse(SecretMasker.isSensitiveKey("username"));
        assertFalse(SecretMasker.isSensitiveKey("key_path"));
        assertFalse(SecretMasker.isSensitiveKey(" "));
        assertFalse(SecretMasker.isSensitiveKey(null));
    }
}
