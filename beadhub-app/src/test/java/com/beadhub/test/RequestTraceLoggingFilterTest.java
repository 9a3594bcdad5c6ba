package com.beadhub.test;

import com.beadhub.api.response.Response;
import com.beadhub.config.ObservabilityHttpLogProperties;
import com.beadhub.config.RequestTraceLoggingFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RequestTraceLoggingFilterTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        ObservabilityHttpLogProperties properties = new ObservabilityHttpLogProperties();
        properties.setEnabled(true);
        properties.setLogRequestBody(true);
        properties.setSampleRate(1.0D);

        RequestTraceLoggingFilter filter = new RequestTraceLoggingFilter(new ObjectMapper(), properties);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new TestController())
                .addFilters(filter)
                .build();
    }

    @Test
    public void shouldInjectTraceHeadersForApiRequests() throws Exception {
        mockMvc.perform(post("/v1/bdh/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workspace_id\":\"ws-1\",\"issues_jsonl\":\"{}\"}"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.workspace_id").value("ws-1"));
    }

    @Test
    public void shouldEchoInboundTraceId() throws Exception {
        mockMvc.perform(get("/v1/status").header("X-Trace-Id", "trace-abc"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Trace-Id", "trace-abc"));
    }

    @Test
    public void shouldReplaceOversizedTraceId() throws Exception {
        String oversized = "t".repeat(200);
        mockMvc.perform(get("/v1/status").header("X-Trace-Id", oversized))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(result -> {
                    String traceId = result.getResponse().getHeader("X-Trace-Id");
                    if (oversized.equals(traceId)) {
                        throw new AssertionError("oversized trace id should not be echoed");
                    }
                });
    }

    @Test
    public void shouldSkipExcludedStreamPath() throws Exception {
        mockMvc.perform(get("/v1/status/stream"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Trace-Id"))
                .andExpect(header().doesNotExist("X-Request-Id"));
    }

    @RestController
    private static class TestController {

        @PostMapping("/v1/bdh/sync")
        public Response<Map<String, Object>> sync(@RequestBody(required = false) Map<String, Object> request) {
            return ok(request);
        }

        @GetMapping("/v1/status")
        public Response<Map<String, Object>> status() {
            return ok(Map.of("workspace_count", 0));
        }

        @GetMapping("/v1/status/stream")
        public Response<Map<String, Object>> stream() {
            return ok(Map.of());
        }

        private Response<Map<String, Object>> ok(Map<String, Object> data) {
            return Response.<Map<String, Object>>builder()
                    .code("0000")
                    .info("成功")
                    .data(data)
                    .build();
        }
    }
}
