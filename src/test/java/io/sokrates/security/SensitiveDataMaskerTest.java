package io.sokrates.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.sokrates.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysAtAnyDepth() {
        JsonNode input = Jsons.parseObject("""
                {"prompt": "hello",
                 "api_key": "k1",
                 "openaiApiKey": "k2",
                 "nested": {"Password": "p", "count": 3},
                 "list": [{"access-token": "t"}, "plain"]}
                """);
        JsonNode out = SensitiveDataMasker.masked(input);
        Assertions.assertEquals("hello", out.get("prompt").asText());
        Assertions.assertEquals("***", out.get("api_key").asText());
        Assertions.assertEquals("***", out.get("openaiApiKey").asText());
        Assertions.assertEquals("***", out.get("nested").get("Password").asText());
        Assertions.assertEquals(3, out.get("nested").get("count").asInt());
        Assertions.assertEquals("***", out.get("list").get(0).get("access-token").asText());
        Assertions.assertEquals("plain", out.get("list").get(1).asText());
        Assertions.assertEquals("k1", input.get("api_key").asText());
    }

    @Test
    void masksCredentialLookingValues() {
        JsonNode input = Jsons.parseObject(
                "{\"header\":\"Bearer xyz\",\"note\":\"sk-abcdefghijklmnopqrstu\",\"text\":\"sk- is a prefix\"}");
        JsonNode out = SensitiveDataMasker.masked(input);
        Assertions.assertEquals("***", out.get("header").asText());
        Assertions.assertEquals("***", out.get("note").asText());
        Assertions.assertEquals("sk- is a prefix", out.get("text").asText());
        Assertions.assertTrue(SensitiveDataMasker.masked(null).isNull());
    }

    @Test
    void keyNormalization() {
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("API-KEY"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("client_secret"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey("prompt"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey(""));
    }
}
