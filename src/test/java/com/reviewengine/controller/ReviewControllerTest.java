package com.reviewengine.controller;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ReviewControllerTest {

    private static final String BROKEN = "def f():\n    if x > 5\n        return y\n";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String body(Object... keyValues) throws Exception {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return objectMapper.writeValueAsString(map);
    }

    @Test
    void testReviewReturnsIssues() throws Exception {
        mockMvc.perform(post("/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("source", BROKEN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.issues[0].type").value("Syntax Error"))
                .andExpect(jsonPath("$.issues[0].line").value(2))
                .andExpect(jsonPath("$.issues[0].message").value("expected ':'"))
                .andExpect(jsonPath("$.issues[1].type").value("Error"))
                .andExpect(jsonPath("$.counts['Syntax Error']").value(1))
                .andExpect(jsonPath("$.summary", startsWith("Line 2: [Syntax Error] expected ':'")));
    }

    @Test
    void testReviewAcceptsThresholdAsString() throws Exception {
        String source = "def f():\n    a = 1\n    b = 2\n    c = 3\n";

        mockMvc.perform(post("/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("source", source, "maxFunctionStatements", "2")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.issues[0].type").value("Code Smell"))
                .andExpect(jsonPath("$.issues[0].message").value("Function 'f' is too long (3 lines)."));
    }

    @Test
    void testBlankSourceIsBadRequest() throws Exception {
        mockMvc.perform(post("/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("source", "   ")))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/repair")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testInvalidThresholdIsBadRequest() throws Exception {
        mockMvc.perform(post("/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("source", "x = 1\n", "maxFunctionStatements", -1)))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("source", "x = 1\n", "maxFunctionStatements", "many")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("maxFunctionStatements must be an integer"));
    }

    @Test
    void testFractionalOrHugeThresholdIsBadRequest() throws Exception {
        mockMvc.perform(post("/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("source", "x = 1\n", "maxFunctionStatements", 3.7)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("maxFunctionStatements must be an integer"));

        mockMvc.perform(post("/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("source", "x = 1\n", "maxFunctionStatements", 1e20)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("maxFunctionStatements must be an integer"));
    }

    @Test
    void testWholeNumberThresholdIsAccepted() throws Exception {
        mockMvc.perform(post("/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("source", "x = 1\n", "maxFunctionStatements", 3.0)))
                .andExpect(status().isOk());
    }

    @Test
    void testRepairReturnsStages() throws Exception {
        mockMvc.perform(post("/repair")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("source", BROKEN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true))
                .andExpect(jsonPath("$.repaired").value("x = 0\ny = 0\ndef f():\n    if x > 5:\n        return y\n"))
                .andExpect(jsonPath("$.stages[0].stage").value("structural-token-repair"))
                .andExpect(jsonPath("$.stages[0].outcome").value("APPLIED"))
                .andExpect(jsonPath("$.stages[4].outcome").value("SKIPPED"));
    }

    @Test
    void testDeepParenthesesAreASyntaxError() throws Exception {
        String source = "x = " + "(".repeat(100_000) + ")".repeat(100_000) + "\n";

        mockMvc.perform(post("/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("source", source)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.issues[0].type").value("Syntax Error"))
                .andExpect(jsonPath("$.issues[0].message").value("too many nested parentheses"));
    }

    @Test
    void testUnanalyzableSourceIsUnprocessable() throws Exception {
        String source = "x" + ".a".repeat(100_000) + "\n";

        mockMvc.perform(post("/review")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("source", source)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error", startsWith("Source could not be analyzed")));
    }
}
