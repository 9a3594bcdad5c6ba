package com.beadhub.test.domain;

import com.beadhub.domain.auth.adapter.gateway.IIdentityGateway;
import com.beadhub.domain.auth.model.valobj.ApiKeyCredential;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.auth.model.valobj.AuthRequest;
import com.beadhub.domain.auth.service.ProxySignatureDomainService;
import com.beadhub.domain.auth.service.TrustBoundaryDomainService;
import com.beadhub.domain.project.adapter.repository.IProjectRepository;
import com.beadhub.domain.project.model.entity.ProjectEntity;
import com.beadhub.types.enums.PrincipalKindEnum;
import com.beadhub.types.enums.ProjectVisibilityEnum;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TrustBoundaryDomainServiceTest {

    private static final String SECRET = "internal-secret";

    private IIdentityGateway identityGateway;
    private IProjectRepository projectRepository;
    private ProxySignatureDomainService signatures;
    private TrustBoundaryDomainService bearerOnly;
    private TrustBoundaryDomainService proxied;

    @BeforeEach
    public void setUp() {
        identityGateway = mock(IIdentityGateway.class);
        projectRepository = mock(IProjectRepository.class);
        signatures = new ProxySignatureDomainService();
        bearerOnly = new TrustBoundaryDomainService(identityGateway, projectRepository, signatures, "");
        proxied = new TrustBoundaryDomainService(identityGateway, projectRepository, signatures, SECRET);
    }

    @Test
    public void shouldResolveBearerKeyToWorkspaceActor() {
        when(identityGateway.findByPlainKey("aw_sk_live")).thenReturn(credential(null));

        AuthIdentity identity = bearerOnly.resolve(AuthRequest.builder().authorization("Bearer aw_sk_live").build());

        Assertions.assertEquals("p-1", identity.getProjectId());
        Assertions.assertEquals("ws-1", identity.getActorId());
        Assertions.assertEquals(PrincipalKindEnum.API_KEY, identity.getPrincipalKind());
        Assertions.assertEquals("key-1", identity.getPrincipalId());
    }

    @Test
    public void shouldRejectMissingOrRevokedBearer() {
        assertUnauthenticated(() -> bearerOnly.resolve(AuthRequest.builder().build()));
        assertUnauthenticated(() -> bearerOnly.resolve(AuthRequest.builder().authorization("Basic abc").build()));

        when(identityGateway.findByPlainKey("revoked")).thenReturn(credential(LocalDateTime.now().minusDays(1)));
        assertUnauthenticated(() -> bearerOnly.resolve(AuthRequest.builder().authorization("Bearer revoked").build()));
    }

    @Test
    public void shouldIgnoreProxyHeadersWhenSecretNotConfigured() {
        String header = signatures.sign(SECRET, "p-1", PrincipalKindEnum.USER, "u-1", "ws-1");

        assertUnauthenticated(() -> bearerOnly.resolve(AuthRequest.builder()
                .proxySignature(header).projectId("p-1").userId("u-1").actorId("ws-1").build()));
        verify(projectRepository, never()).findById(anyString());
    }

    @Test
    public void shouldResolveSignedUser() {
        when(projectRepository.findById("p-1")).thenReturn(project(ProjectVisibilityEnum.PRIVATE));
        String header = signatures.sign(SECRET, "p-1", PrincipalKindEnum.USER, "u-1", "ws-1");

        AuthIdentity identity = proxied.resolve(AuthRequest.builder()
                .proxySignature(header).projectId("p-1").userId("u-1").actorId("ws-1").build());

        Assertions.assertEquals(PrincipalKindEnum.USER, identity.getPrincipalKind());
        Assertions.assertEquals("u-1", identity.getPrincipalId());
        Assertions.assertEquals("ws-1", identity.getActorId());
    }

    @Test
    public void shouldRejectUnsignedActorOverride() {
        when(projectRepository.findById("p-1")).thenReturn(project(ProjectVisibilityEnum.PRIVATE));
        String header = signatures.sign(SECRET, "p-1", PrincipalKindEnum.USER, "u-1", "ws-1");

        assertUnauthenticated(() -> proxied.resolve(AuthRequest.builder()
                .proxySignature(header).projectId("p-1").userId("u-1").actorId("ws-2").build()));
        assertUnauthenticated(() -> proxied.resolve(AuthRequest.builder()
                .proxySignature(header).projectId("p-2").userId("u-1").actorId("ws-1").build()));
    }

    @Test
    public void shouldAllowPublicReaderOnlyForPublicProject() {
        String header = signatures.sign(SECRET, "p-1", PrincipalKindEnum.PUBLIC_READER, null, null);
        AuthRequest request = AuthRequest.builder().proxySignature(header).projectId("p-1").build();

        when(projectRepository.findById("p-1")).thenReturn(project(ProjectVisibilityEnum.PUBLIC));
        AuthIdentity reader = proxied.resolve(request);
        Assertions.assertTrue(reader.isPublicReader());
        Assertions.assertNull(reader.getActorId());

        when(projectRepository.findById("p-1")).thenReturn(project(ProjectVisibilityEnum.PRIVATE));
        AppException ex = Assertions.assertThrows(AppException.class, () -> proxied.resolve(request));
        Assertions.assertEquals(ResponseCode.FORBIDDEN.getCode(), ex.getCode());
    }

    @Test
    public void shouldEnforceActorBindingAndReadOnly() {
        AuthIdentity agent = AuthIdentity.builder().projectId("p-1").actorId("ws-1")
                .principalKind(PrincipalKindEnum.API_KEY).principalId("key-1").build();
        AuthIdentity reader = AuthIdentity.builder().projectId("p-1")
                .principalKind(PrincipalKindEnum.PUBLIC_READER).build();

        Assertions.assertDoesNotThrow(() -> bearerOnly.ensureActorBinding(agent, "ws-1"));
        Assertions.assertDoesNotThrow(() -> bearerOnly.ensureActorBinding(agent, null));
        Assertions.assertThrows(AppException.class, () -> bearerOnly.ensureActorBinding(agent, "ws-2"));
        Assertions.assertDoesNotThrow(() -> bearerOnly.ensureWritable(agent));
        AppException ex = Assertions.assertThrows(AppException.class, () -> bearerOnly.ensureWritable(reader));
        Assertions.assertEquals(ResponseCode.FORBIDDEN.getCode(), ex.getCode());
    }

    private void assertUnauthenticated(Executable executable) {
        AppException ex = Assertions.assertThrows(AppException.class, executable);
        Assertions.assertEquals(ResponseCode.UNAUTHENTICATED.getCode(), ex.getCode());
    }

    private ApiKeyCredential credential(LocalDateTime revokedAt) {
        return ApiKeyCredential.builder()
                .apiKeyId("key-1")
                .projectId("p-1")
                .agentId("ws-1")
                .revokedAt(revokedAt)
                .build();
    }

    private ProjectEntity project(ProjectVisibilityEnum visibility) {
        ProjectEntity project = new ProjectEntity();
        project.setId("p-1");
        project.setVisibility(visibility);
        return project;
    }
}
