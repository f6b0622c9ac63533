package com.yoursp.vkyc.modules.verification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.vkyc.config.ExternalServiceProperties;
import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.model.enums.RegistryStatus;
import com.yoursp.vkyc.modules.verification.exception.RegistryTransientException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class HttpRegistryClientTest {

    private static final String URL = "http://registry.test/verify";
    private static final Map<String, String> FIELDS = Map.of("pan_number", "ABCDE1234F");

    @Mock
    private RestTemplate restTemplate;

    private final ObjectMapper mapper = new ObjectMapper();
    private HttpRegistryClient client;

    @BeforeEach
    void setUp() {
        ExternalServiceProperties properties = new ExternalServiceProperties();
        properties.getRegistry().setUrl(URL);
        properties.getRegistry().setApiKey("registry-key");
        client = new HttpRegistryClient(restTemplate, properties);
    }

    private void respond(String json) throws Exception {
        when(restTemplate.postForObject(eq(URL), any(HttpEntity.class), eq(JsonNode.class)))
                .thenReturn(mapper.readTree(json));
    }

    @Test
    @DisplayName("status field maps to the registry verdict")
    void statusField() throws Exception {
        respond("{\"status\":\"mismatched\"}");

        assertEquals(RegistryStatus.MISMATCHED, client.verify(FIELDS, DocumentType.PAN));
    }

    @Test
    @DisplayName("Legacy verified flag is understood")
    void legacyVerifiedFlag() throws Exception {
        respond("{\"verified\":true}");

        assertEquals(RegistryStatus.MATCHED, client.verify(FIELDS, DocumentType.PAN));
    }

    @Test
    @DisplayName("Request carries doc_type, doc_info and the bearer key")
    @SuppressWarnings("unchecked")
    void requestShape() throws Exception {
        respond("{\"status\":\"matched\"}");

        client.verify(FIELDS, DocumentType.AADHAAR);

        ArgumentCaptor<HttpEntity<Map<String, Object>>> request = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).postForObject(eq(URL), request.capture(), eq(JsonNode.class));
        assertEquals("aadhaar", request.getValue().getBody().get("doc_type"));
        assertEquals(FIELDS, request.getValue().getBody().get("doc_info"));
        assertEquals("Bearer registry-key", request.getValue().getHeaders().getFirst("Authorization"));
    }

    @Test
    @DisplayName("Timeouts and unreadable answers are transient")
    void transientFailures() throws Exception {
        when(restTemplate.postForObject(eq(URL), any(HttpEntity.class), eq(JsonNode.class)))
                .thenThrow(new ResourceAccessException("Read timed out"))
                .thenReturn(mapper.readTree("{\"status\":\"maybe\"}"))
                .thenReturn(mapper.readTree("{}"))
                .thenReturn(null);

        for (int i = 0; i < 4; i++) {
            assertThrows(RegistryTransientException.class, () -> client.verify(FIELDS, DocumentType.PAN));
        }
    }
}
