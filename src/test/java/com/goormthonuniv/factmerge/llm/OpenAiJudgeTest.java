package com.goormthonuniv.factmerge.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiJudgeTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void scoreMustBeNumberInRange() {
        assertEquals(Optional.of(0.8123), OpenAiJudge.parseScore(om, "{\"score\": 0.81234, \"type\": \"news\"}"));
        assertTrue(OpenAiJudge.parseScore(om, "{\"score\": 1.4}").isEmpty());
        assertTrue(OpenAiJudge.parseScore(om, "{\"score\": \"high\"}").isEmpty());
        assertTrue(OpenAiJudge.parseScore(om, "not json").isEmpty());
    }

    @Test
    void claimsKeepOnlyNonBlankStrings() {
        Optional<List<String>> claims = OpenAiJudge.parseClaims(om,
                "{\"claims\": [\" Solar output rose 12% in 2023. \", 42, \"\", \"Wind capacity doubled.\"]}");
        assertEquals(List.of("Solar output rose 12% in 2023.", "Wind capacity doubled."), claims.orElseThrow());
        assertTrue(OpenAiJudge.parseClaims(om, "{\"results\": []}").isEmpty());
    }

    @Test
    void disabledJudgeNeverCallsOut() {
        OpenAiJudge judge = new OpenAiJudge(RestClient.create(), om, "", "gpt-4o-mini", "openai");
        assertFalse(judge.isEnabled());
        assertTrue(judge.rateDomain("example.com").isEmpty());
        assertTrue(judge.extractClaims("x", "some text").isEmpty());

        OpenAiJudge noneProvider = new OpenAiJudge(RestClient.create(), om, "sk-test", "gpt-4o-mini", "none");
        assertFalse(noneProvider.isEnabled());
    }
}
