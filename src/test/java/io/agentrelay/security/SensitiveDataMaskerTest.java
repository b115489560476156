package io.agentrelay.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void masksCredentialKeysAtAnyDepth() {
        Map<String, Object> masked = SensitiveDataMasker.masked(Map.of(
                "Password", "pw",
                "nested", Map.of("client_secret", "s", "region", "eu-west"),
                "count", 3
        ));

        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.get("Password"));
        Assertions.assertEquals(Map.of("client_secret", SensitiveDataMasker.MASK, "region", "eu-west"), masked.get("nested"));
        Assertions.assertEquals(3, masked.get("count"));
    }

    @Test
    void masksOpaqueTokensButKeepsBrokerIds() {
        String envelopeId = "env_0f8fad5b-d9cb-469f-a165-70867728950e";
        Map<String, Object> masked = SensitiveDataMasker.masked(Map.of(
                "ids", List.of(envelopeId, "sk-ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789"),
                "note", "short text"
        ));

        Assertions.assertEquals(List.of(envelopeId, SensitiveDataMasker.MASK), masked.get("ids"));
        Assertions.assertEquals("short text", masked.get("note"));
        Assertions.assertTrue(SensitiveDataMasker.masked(null).isEmpty());
    }

    @Test
    void sensitiveKeyMatchingIsCaseInsensitive() {
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("X-Authorization"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("ApiKey"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey("priority"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey(null));
    }
}
