package com.cgi.schemasense.service;

import com.cgi.schemasense.api.AiClassificationClient;
import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.exception.AiUnavailableException;
import com.cgi.schemasense.model.AiFieldVerdict;
import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.TableContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the external AI classification service.
 * Uses RestTemplate to post one table's edge-case fields per call.
 */
@Component
public class RestAiClassificationClient implements AiClassificationClient {
    private static final Logger log = LoggerFactory.getLogger(RestAiClassificationClient.class);

    private final String serviceUrl;
    private final RestTemplate restTemplate;

    @Autowired
    public RestAiClassificationClient(ClassificationProperties properties) {
        this(properties.getAi().getUrl(), createRestTemplate(properties));
    }

    public RestAiClassificationClient(String serviceUrl, RestTemplate restTemplate) {
        this.serviceUrl = serviceUrl;
        this.restTemplate = restTemplate;
        log.info("AI classification client initialized with URL: {}", serviceUrl);
    }

    @Override
    public List<AiFieldVerdict> submitBatch(List<ColumnMetadata> fields, TableContext tableContext) {
        if (fields == null || fields.isEmpty()) {
            return List.of();
        }

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("table", tableContext.getTableName());
        requestBody.put("domain", tableContext.getDomainCategory().name());
        requestBody.put("domain_confidence", tableContext.getConfidence());
        List<Map<String, Object>> payload = new ArrayList<>(fields.size());
        for (ColumnMetadata field : fields) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("field_ref", field.getFieldRef());
            item.put("column", field.getColumnName());
            item.put("data_type", field.getDataType());
            payload.add(item);
        }
        requestBody.put("fields", payload);

        log.debug("Sending {} fields of table {} to AI service", fields.size(), tableContext.getTableName());
        try {
            ResponseEntity<Map<String, List<AiFieldVerdict>>> response = restTemplate.exchange(
                    serviceUrl,
                    HttpMethod.POST,
                    new HttpEntity<>(requestBody),
                    new ParameterizedTypeReference<Map<String, List<AiFieldVerdict>>>() {});

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new AiUnavailableException("AI service answered " + response.getStatusCode());
            }
            List<AiFieldVerdict> verdicts = response.getBody().get("results");
            return verdicts != null ? verdicts : List.of();
        } catch (RestClientException e) {
            throw new AiUnavailableException("AI service call failed: " + e.getMessage(), e);
        }
    }

    /**
     * Creates a RestTemplate whose timeouts follow the configured AI call timeout.
     *
     * @param properties Configuration
     * @return Configured RestTemplate
     */
    private static RestTemplate createRestTemplate(ClassificationProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMs = (int) properties.getAi().getTimeout().toMillis();
        requestFactory.setConnectTimeout(Math.min(timeoutMs, 5000));
        requestFactory.setReadTimeout(timeoutMs);
        return new RestTemplate(requestFactory);
    }
}
