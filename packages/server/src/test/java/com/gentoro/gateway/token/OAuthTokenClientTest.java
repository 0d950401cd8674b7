package com.gentoro.gateway.token;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gateway.credentials.TenantCredential;
import com.gentoro.gateway.exception.GatewayErrorCode;
import com.gentoro.gateway.exception.UpstreamAuthException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OAuthTokenClientTest {

  private MockWebServer server;
  private OAuthTokenClient client;
  private TenantCredential credential;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    client = new OAuthTokenClient(new OkHttpClient());
    credential =
        new TenantCredential(
            "team-x",
            "client-x",
            "s3cr&t",
            server.url("/oauth/token").toString(),
            "https://api",
            "rg-x");
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void postsClientCredentialsForm() throws Exception {
    server.enqueue(
        new MockResponse()
            .setBody("{\"access_token\":\"abc\",\"token_type\":\"bearer\",\"expires_in\":3599}"));

    TokenResponse token = client.fetch(credential);

    assertEquals("abc", token.accessToken());
    assertEquals(3599, token.expiresIn());
    RecordedRequest request = server.takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals("/oauth/token", request.getPath());
    assertTrue(request.getHeader("Content-Type").startsWith("application/x-www-form-urlencoded"));
    assertEquals(
        "grant_type=client_credentials&client_id=client-x&client_secret=s3cr%26t",
        request.getBody().readUtf8());
  }

  @Test
  void rejectedRequestCarriesStatusAndBody() {
    server.enqueue(new MockResponse().setResponseCode(401).setBody("invalid_client"));

    UpstreamAuthException ex =
        assertThrows(UpstreamAuthException.class, () -> client.fetch(credential));

    assertEquals(GatewayErrorCode.UPSTREAM_AUTH_FAILED, ex.getCode());
    assertEquals(401, ex.getContext().get("status"));
    assertEquals("invalid_client", ex.getContext().get("body"));
    assertEquals("team-x", ex.getContext().get("tenant"));
  }

  @Test
  void undecodableBodyIsAnAuthFailure() {
    server.enqueue(new MockResponse().setBody("<html>login</html>"));

    assertThrows(UpstreamAuthException.class, () -> client.fetch(credential));
  }

  @Test
  void missingAccessTokenIsAnAuthFailure() {
    server.enqueue(new MockResponse().setBody("{\"token_type\":\"bearer\"}"));

    assertThrows(UpstreamAuthException.class, () -> client.fetch(credential));
  }
}
