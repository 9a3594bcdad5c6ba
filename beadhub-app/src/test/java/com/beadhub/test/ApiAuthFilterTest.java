package com.beadhub.test;

import com.beadhub.api.response.Response;
import com.beadhub.config.ApiAuthFilter;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.auth.model.valobj.AuthRequest;
import com.beadhub.domain.auth.service.TrustBoundaryDomainService;
import com.beadhub.types.enums.PrincipalKindEnum;
import com.beadhub.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ApiAuthFilterTest {

    private MockMvc mockMvc;
    private TrustBoundaryDomainService trustBoundaryDomainService;

    @BeforeEach
    public void setUp() {
        this.trustBoundaryDomainService = mock(TrustBoundaryDomainService.class);
        ApiAuthFilter apiAuthFilter = new ApiAuthFilter(new ObjectMapper(), trustBoundaryDomainService);
        this.mockMvc = MockMvcBuilders
                .standaloneSetup(new EchoController())
                .addFilters(apiAuthFilter)
                .build();
    }

    @Test
    public void shouldRejectMissingCredentialsWithEnvelope() throws Exception {
        when(trustBoundaryDomainService.resolve(any())).thenThrow(AppException.unauthenticated("Missing bearer token"));

        mockMvc.perform(get("/v1/ping"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("0003"))
                .andExpect(jsonPath("$.info").value("Missing bearer token"));
    }

    @Test
    public void shouldExposeResolvedIdentityToHandlers() throws Exception {
        when(trustBoundaryDomainService.resolve(any())).thenReturn(agent());

        mockMvc.perform(get("/v1/ping").header("Authorization", "Bearer aw_sk_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("ws-1"));

        ArgumentCaptor<AuthRequest> captor = ArgumentCaptor.forClass(AuthRequest.class);
        verify(trustBoundaryDomainService).resolve(captor.capture());
        assertEquals("Bearer aw_sk_1", captor.getValue().getAuthorization());
    }

    @Test
    public void shouldPassProxyHeadersThrough() throws Exception {
        when(trustBoundaryDomainService.resolve(any())).thenReturn(agent());

        mockMvc.perform(get("/v1/ping")
                        .header("X-BH-Auth", "v2:p-1:u:u-1:ws-1:abc")
                        .header("X-Project-ID", "p-1")
                        .header("X-User-ID", "u-1")
                        .header("X-Aweb-Actor-ID", "ws-1"))
                .andExpect(status().isOk());

        ArgumentCaptor<AuthRequest> captor = ArgumentCaptor.forClass(AuthRequest.class);
        verify(trustBoundaryDomainService).resolve(captor.capture());
        assertEquals("v2:p-1:u:u-1:ws-1:abc", captor.getValue().getProxySignature());
        assertEquals("p-1", captor.getValue().getProjectId());
        assertEquals("u-1", captor.getValue().getUserId());
        assertEquals("ws-1", captor.getValue().getActorId());
    }

    @Test
    public void shouldRejectWritesFromPublicReader() throws Exception {
        when(trustBoundaryDomainService.resolve(any())).thenReturn(AuthIdentity.builder()
                .projectId("p-1")
                .principalKind(PrincipalKindEnum.PUBLIC_READER)
                .build());

        mockMvc.perform(get("/v1/ping"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/v1/ping"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("0004"));
    }

    @Test
    public void shouldBypassInitAndNonApiPaths() throws Exception {
        mockMvc.perform(post("/v1/init"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("init"));
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk());

        verify(trustBoundaryDomainService, never()).resolve(any());
    }

    private AuthIdentity agent() {
        return AuthIdentity.builder()
                .projectId("p-1")
                .actorId("ws-1")
                .principalKind(PrincipalKindEnum.API_KEY)
                .principalId("key-1")
                .build();
    }

    @RestController
    private static class EchoController {

        @GetMapping("/v1/ping")
        public Response<String> ping(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity) {
            return ok(identity.getActorId());
        }

        @PostMapping("/v1/ping")
        public Response<String> write(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity) {
            return ok(identity.getActorId());
        }

        @PostMapping("/v1/init")
        public Response<String> init() {
            return ok("init");
        }

        @GetMapping("/health")
        public Response<String> health() {
            return ok("up");
        }

        private Response<String> ok(String data) {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .data(data)
                    .build();
        }
    }
}
