package com.gentoro.gateway.deployment;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.gateway.credentials.CredentialStore;
import com.gentoro.gateway.credentials.TenantCredential;
import com.gentoro.gateway.deployment.model.DeploymentCreated;
import com.gentoro.gateway.deployment.model.DeploymentDeleted;
import com.gentoro.gateway.deployment.model.DeploymentDetails;
import com.gentoro.gateway.deployment.model.DeploymentModification;
import com.gentoro.gateway.deployment.model.DeploymentPage;
import com.gentoro.gateway.deployment.model.ScenarioModels;
import com.gentoro.gateway.exception.ConfigMissingException;
import com.gentoro.gateway.exception.DecodeException;
import com.gentoro.gateway.exception.DeploymentNotFoundException;
import com.gentoro.gateway.exception.UpstreamRequestException;
import com.gentoro.gateway.token.TokenCache;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AiCoreClientTest {

  @Mock private CredentialStore credentials;
  @Mock private TokenCache tokens;

  private MockWebServer server;
  private AiCoreClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    lenient()
        .when(credentials.get("team-x"))
        .thenReturn(
            new TenantCredential(
                "team-x",
                "id",
                "secret",
                "https://auth",
                server.url("/api").toString(),
                "rg-x"));
    lenient().when(tokens.getToken("team-x")).thenReturn("tok-x");
    client = new AiCoreClient(new OkHttpClient(), credentials, tokens);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void listingCarriesTenantHeadersAndDecodesPage() throws Exception {
    server.enqueue(
        new MockResponse()
            .setBody(
                """
                {"count": 1, "resources": [{
                  "id": "d-1", "scenarioId": "foundation-models", "status": "RUNNING",
                  "deploymentUrl": "https://inference/d-1",
                  "details": {"resources": {"backend_details": {"model": {"name": "gpt-4o"}}}},
                  "unexpected": true
                }]}
                """));

    DeploymentPage page = client.listDeployments("team-x");

    assertEquals(1, page.count());
    assertEquals("d-1", page.resources().get(0).id());
    assertEquals("gpt-4o", page.resources().get(0).modelName().orElseThrow());
    RecordedRequest request = server.takeRequest();
    assertEquals("GET", request.getMethod());
    assertEquals("/api/v2/lm/deployments", request.getPath());
    assertEquals("Bearer tok-x", request.getHeader("Authorization"));
    assertEquals("rg-x", request.getHeader(AiCoreClient.RESOURCE_GROUP_HEADER));
  }

  @Test
  void missingDeploymentIsNotFound() {
    server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"error\":\"nope\"}"));

    assertThrows(DeploymentNotFoundException.class, () -> client.getDeployment("team-x", "d-9"));
  }

  @Test
  void deploymentDetailsAreDecoded() throws Exception {
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"id\":\"d-1\",\"ttl\":\"1h\",\"lastOperation\":\"CREATE\","
                    + "\"statusDetails\":{\"x\":1}}"));

    DeploymentDetails details = client.getDeployment("team-x", "d-1");

    assertEquals("1h", details.ttl());
    assertEquals("CREATE", details.lastOperation());
    assertEquals(1, details.statusDetails().path("x").asInt());
    assertEquals("/api/v2/lm/deployments/d-1", server.takeRequest().getPath());
  }

  @Test
  void upstreamErrorKeepsStatusAndBody() {
    server.enqueue(new MockResponse().setResponseCode(503).setBody("maintenance"));

    UpstreamRequestException ex =
        assertThrows(UpstreamRequestException.class, () -> client.listDeployments("team-x"));

    assertEquals(503, ex.getStatus());
    assertEquals("maintenance", ex.getBody());
  }

  @Test
  void undecodableBodyIsDecodeFailure() {
    server.enqueue(new MockResponse().setBody("not json"));

    assertThrows(DecodeException.class, () -> client.listDeployments("team-x"));
  }

  @Test
  void createDeploymentPostsConfigurationAndTtl() throws Exception {
    server.enqueue(
        new MockResponse()
            .setBody("{\"id\":\"d-2\",\"message\":\"Scheduled\",\"status\":\"UNKNOWN\"}"));

    DeploymentCreated created = client.createDeployment("team-x", "cfg-1", "2h");

    assertEquals("d-2", created.id());
    RecordedRequest request = server.takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals("{\"configurationId\":\"cfg-1\",\"ttl\":\"2h\"}", request.getBody().readUtf8());
  }

  @Test
  void updateAndDeleteUseTheirVerbs() throws Exception {
    server.enqueue(new MockResponse().setBody("{\"id\":\"d-1\",\"targetStatus\":\"STOPPED\"}"));
    server.enqueue(new MockResponse().setBody("{\"id\":\"d-1\",\"message\":\"Deletion done\"}"));

    client.updateDeployment("team-x", "d-1", new DeploymentModification("STOPPED", null));
    DeploymentDeleted deleted = client.deleteDeployment("team-x", "d-1");

    RecordedRequest patch = server.takeRequest();
    assertEquals("PATCH", patch.getMethod());
    assertEquals("{\"targetStatus\":\"STOPPED\"}", patch.getBody().readUtf8());
    assertEquals("DELETE", server.takeRequest().getMethod());
    assertEquals("Deletion done", deleted.message());
  }

  @Test
  void modelsPathEncodesScenario() throws Exception {
    server.enqueue(new MockResponse().setBody("{\"count\":0,\"resources\":[]}"));

    ScenarioModels models = client.listModels("team-x", "foundation models");

    assertEquals(0, models.count());
    assertEquals(
        "/api/v2/lm/scenarios/foundation%20models/models", server.takeRequest().getPath());
  }

  @Test
  void invalidApiUrlIsConfigurationProblem() {
    when(credentials.get("team-bad"))
        .thenReturn(new TenantCredential("team-bad", "id", "s", "https://auth", "::", "rg"));

    assertThrows(ConfigMissingException.class, () -> client.listDeployments("team-bad"));
  }
}
