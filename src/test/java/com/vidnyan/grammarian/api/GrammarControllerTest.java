package com.vidnyan.grammarian.api;

import com.vidnyan.grammarian.GrammarianProperties;
import com.vidnyan.grammarian.adapter.out.check.IdenticalAlternativesCheck;
import com.vidnyan.grammarian.adapter.out.file.FileSystemGrammarSourceRepository;
import com.vidnyan.grammarian.adapter.out.oracle.UnavailableGroundTruthOracle;
import com.vidnyan.grammarian.application.service.GrammarAnalysisService;
import com.vidnyan.grammarian.application.service.GrammarQueryService;
import com.vidnyan.grammarian.application.service.GrammarResolutionService;
import com.vidnyan.grammarian.application.service.GrammarSimulationService;
import com.vidnyan.grammarian.domain.format.FormattingInferencer;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.rewrite.GrammarRewriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GrammarControllerTest {

    private static final String EXPR = "grammar Expr;\nexpr : ID | NUMBER | ID ;\nID : [a-z]+ ;\nNUMBER : [0-9]+ ;\nWS : [ ]+ -> skip ;\n";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        GrammarModelBuilder builder = new GrammarModelBuilder();
        FileSystemGrammarSourceRepository repository = new FileSystemGrammarSourceRepository();
        GrammarianProperties properties = new GrammarianProperties();
        GrammarAnalysisService analysis = new GrammarAnalysisService(repository,
                new GrammarResolutionService(repository, builder, new GrammarRewriter()),
                List.of(new IdenticalAlternativesCheck()), builder, new FormattingInferencer(), properties);
        GrammarSimulationService simulation = new GrammarSimulationService(builder,
                new UnavailableGroundTruthOracle(), properties);
        mockMvc = MockMvcBuilders.standaloneSetup(new GrammarController(analysis, simulation,
                new GrammarQueryService(builder))).build();
    }

    @Test
    void health_ShouldAnswer() throws Exception {
        mockMvc.perform(get("/api/grammar/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK - Grammarian"));
    }

    @Test
    void analyze_ShouldReturnIssuesForInlineGrammar() throws Exception {
        // Arrange
        String body = objectMapper.writeValueAsString(Map.of("source", EXPR));

        // Act & Assert
        mockMvc.perform(post("/api/grammar/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.grammar").value("Expr"))
                .andExpect(jsonPath("$.kind").value("COMBINED"))
                .andExpect(jsonPath("$.issues[0].type").value("identical-alternatives"));
    }

    @Test
    void testRule_ShouldReturnSimulatedMatch() throws Exception {
        // Arrange
        String body = objectMapper.writeValueAsString(Map.of("source", EXPR, "ruleName", "expr", "input", "abc"));

        // Act & Assert
        mockMvc.perform(post("/api/grammar/test-rule").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("MATCHED"))
                .andExpect(jsonPath("$.source").value("SIMULATION"));
    }

    @Test
    void exportMarkdown_ShouldRenderRuleSections() throws Exception {
        // Arrange
        String body = objectMapper.writeValueAsString(Map.of("source", EXPR));

        // Act & Assert
        mockMvc.perform(post("/api/grammar/export-markdown").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("# Grammar: Expr")))
                .andExpect(content().string(containsString("### `expr`")));
    }

    @Test
    void outline_ShouldListRules() throws Exception {
        // Arrange
        String body = objectMapper.writeValueAsString(Map.of("source", EXPR));

        // Act & Assert
        mockMvc.perform(post("/api/grammar/outline").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("Rules (4):")))
                .andExpect(content().string(containsString("  - NUMBER (lexer)")));
    }
}
