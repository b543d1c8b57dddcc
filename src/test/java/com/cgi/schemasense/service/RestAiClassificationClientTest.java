package com.cgi.schemasense.service;

import com.cgi.schemasense.exception.AiUnavailableException;
import com.cgi.schemasense.model.AiFieldVerdict;
import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.TableContext;
import com.cgi.schemasense.model.enums.DomainCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static com.cgi.schemasense.SchemaFixtures.column;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestAiClassificationClientTest {

    private static final String URL = "http://ai.test/classify";

    private MockRestServiceServer server;
    private RestAiClassificationClient client;
    private final TableContext context = TableContext.builder()
            .tableName("lab_results")
            .domainCategory(DomainCategory.HEALTHCARE)
            .domainScores(Map.of(DomainCategory.HEALTHCARE, 2.0))
            .confidence(1.0)
            .build();

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RestAiClassificationClient(URL, restTemplate);
    }

    @Test
    void postsFieldsAndParsesVerdicts() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.table").value("lab_results"))
                .andExpect(jsonPath("$.domain").value("HEALTHCARE"))
                .andExpect(jsonPath("$.fields[0].field_ref").value("lab_results.rslt_cd"))
                .andRespond(withSuccess("{\"results\": [{\"field_ref\": \"lab_results.rslt_cd\","
                        + " \"pii_type\": \"MEDICAL\", \"confidence\": 0.88, \"regulation\": \"HIPAA\"}]}",
                        MediaType.APPLICATION_JSON));

        List<AiFieldVerdict> verdicts = client.submitBatch(List.of(column("lab_results", "rslt_cd")), context);

        server.verify();
        assertEquals(1, verdicts.size());
        assertEquals("MEDICAL", verdicts.get(0).getPiiType());
        assertEquals(0.88, verdicts.get(0).getConfidence());
        assertEquals("HIPAA", verdicts.get(0).getRegulation());
    }

    @Test
    void missingResultsMeansNoVerdicts() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertTrue(client.submitBatch(List.of(column("lab_results", "rslt_cd")), context).isEmpty());
    }

    @Test
    void serverErrorRaisesAiUnavailable() {
        server.expect(requestTo(URL)).andRespond(withServerError());
        List<ColumnMetadata> fields = List.of(column("lab_results", "rslt_cd"));

        AiUnavailableException e = assertThrows(AiUnavailableException.class,
                () -> client.submitBatch(fields, context));
        assertEquals("AI_UNAVAILABLE", e.getErrorCode());
        assertTrue(e.isTransientFailure());
    }

    @Test
    void emptyBatchSkipsTheCall() {
        assertTrue(client.submitBatch(List.of(), context).isEmpty());
        server.verify();
    }
}
