package com.gentoro.gateway.token;

import com.gentoro.gateway.credentials.TenantCredential;
import com.gentoro.gateway.exception.UpstreamAuthException;
import com.gentoro.gateway.utility.JacksonUtility;
import java.io.IOException;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** {@link TokenFetcher} issuing a form-encoded client-credentials request with OkHttp. */
public class OAuthTokenClient implements TokenFetcher {
  private static final org.slf4j.Logger log =
      com.gentoro.gateway.logging.LoggingService.getLogger(OAuthTokenClient.class);
  private final OkHttpClient httpClient;

  public OAuthTokenClient(OkHttpClient httpClient) {
    this.httpClient = httpClient;
  }

  @Override
  public TokenResponse fetch(TenantCredential credential) {
    String tenant = credential.tenantId();
    FormBody form =
        new FormBody.Builder()
            .add("grant_type", "client_credentials")
            .add("client_id", credential.clientId())
            .add("client_secret", credential.clientSecret())
            .build();
    Request request = new Request.Builder().url(credential.tokenUrl()).post(form).build();

    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        log.warn("Token request for tenant {} failed with status {}", tenant, response.code());
        throw new UpstreamAuthException(tenant, response.code(), text);
      }
      TokenResponse token;
      try {
        token = JacksonUtility.getJsonMapper().readValue(text, TokenResponse.class);
      } catch (Exception e) {
        throw new UpstreamAuthException(
            tenant, "Failed to decode token response for tenant " + tenant, e);
      }
      if (token == null || token.accessToken() == null || token.accessToken().isBlank()) {
        throw new UpstreamAuthException(tenant, response.code(), text);
      }
      return token;
    } catch (IOException e) {
      throw new UpstreamAuthException(
          tenant, "Failed to reach token endpoint for tenant " + tenant, e);
    }
  }
}
