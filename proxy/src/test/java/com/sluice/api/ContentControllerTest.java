package com.sluice.api;

import com.sluice.content.ContentResponse;
import com.sluice.content.ContentService;
import com.sluice.model.DispatchErrorKind;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ContentController.class)
class ContentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ContentService contentService;

    @Test
    void searchReturnsContent() throws Exception {
        when(contentService.search("spring boot")).thenReturn(ContentResponse.builder()
                .success(true)
                .query("spring boot")
                .content("results")
                .source("jina_search")
                .servedBy("10.0.0.1:80")
                .statusCode(200)
                .attempts(1)
                .timestamp(Instant.now())
                .build());

        mockMvc.perform(post("/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"  spring boot  \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.content").value("results"))
                .andExpect(jsonPath("$.servedBy").value("10.0.0.1:80"))
                .andExpect(jsonPath("$.error").doesNotExist());

        verify(contentService).search("spring boot");
    }

    @Test
    void searchRejectsBlankQuery() throws Exception {
        mockMvc.perform(post("/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing or empty 'query' field"));

        verifyNoInteractions(contentService);
    }

    @Test
    void searchRejectsMissingBody() throws Exception {
        mockMvc.perform(post("/search").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No JSON data provided"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/read")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("No JSON data provided"));
    }

    @Test
    void readRejectsMissingUrl() throws Exception {
        mockMvc.perform(post("/read")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing or empty 'url' field"));
    }

    @Test
    void readRejectsNonHttpUrl() throws Exception {
        mockMvc.perform(post("/read")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"ftp://example.com\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("URL must start with http:// or https://"));

        verifyNoInteractions(contentService);
    }

    @Test
    void readRejectsUnparseableUrl() throws Exception {
        mockMvc.perform(post("/read")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"https://example.com/a b|c\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("URL is not valid"));

        verifyNoInteractions(contentService);
    }

    @Test
    void invalidRequestResultIsBadRequest() throws Exception {
        when(contentService.search(anyString())).thenReturn(ContentResponse.builder()
                .success(false)
                .error("Invalid request")
                .errorKind(DispatchErrorKind.INVALID_REQUEST)
                .attempts(1)
                .build());

        mockMvc.perform(post("/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"anything\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorKind").value("INVALID_REQUEST"));
    }

    @Test
    void exhaustedReadIsBadGateway() throws Exception {
        when(contentService.read(anyString())).thenReturn(ContentResponse.builder()
                .success(false)
                .url("https://example.com")
                .error("All attempts failed")
                .errorKind(DispatchErrorKind.ALL_ATTEMPTS_EXHAUSTED)
                .attempts(4)
                .timestamp(Instant.now())
                .build());

        mockMvc.perform(post("/read")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"https://example.com\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorKind").value("ALL_ATTEMPTS_EXHAUSTED"))
                .andExpect(jsonPath("$.content").doesNotExist());
    }

    @Test
    void deadlineExceededIsGatewayTimeout() throws Exception {
        when(contentService.read(anyString())).thenReturn(ContentResponse.builder()
                .success(false)
                .error("Call budget exhausted after 2 attempts")
                .errorKind(DispatchErrorKind.DEADLINE_EXCEEDED)
                .build());

        mockMvc.perform(post("/read")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"https://example.com\"}"))
                .andExpect(status().isGatewayTimeout());
    }

    @Test
    void unknownPathListsEndpoints() throws Exception {
        mockMvc.perform(get("/nowhere"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Endpoint not found"))
                .andExpect(jsonPath("$.availableEndpoints[1]").value("/search"));
    }
}
