package com.gentoro.gateway.deployment;

import com.gentoro.gateway.credentials.CredentialStore;
import com.gentoro.gateway.credentials.TenantCredential;
import com.gentoro.gateway.deployment.model.ConfigurationCreated;
import com.gentoro.gateway.deployment.model.ConfigurationRequest;
import com.gentoro.gateway.deployment.model.Configurations;
import com.gentoro.gateway.deployment.model.DeploymentCreated;
import com.gentoro.gateway.deployment.model.DeploymentDeleted;
import com.gentoro.gateway.deployment.model.DeploymentDetails;
import com.gentoro.gateway.deployment.model.DeploymentModification;
import com.gentoro.gateway.deployment.model.DeploymentModified;
import com.gentoro.gateway.deployment.model.DeploymentPage;
import com.gentoro.gateway.deployment.model.ScenarioModels;
import com.gentoro.gateway.exception.ConfigMissingException;
import com.gentoro.gateway.exception.DecodeException;
import com.gentoro.gateway.exception.DeploymentNotFoundException;
import com.gentoro.gateway.exception.NetworkException;
import com.gentoro.gateway.exception.UpstreamRequestException;
import com.gentoro.gateway.token.TokenCache;
import com.gentoro.gateway.utility.JacksonUtility;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;

/**
 * Authenticated JSON calls against a tenant's API base. Every request carries the tenant's bearer
 * token and its {@code AI-Resource-Group}.
 */
public class AiCoreClient {
  private static final org.slf4j.Logger log =
      com.gentoro.gateway.logging.LoggingService.getLogger(AiCoreClient.class);
  public static final String RESOURCE_GROUP_HEADER = "AI-Resource-Group";
  public static final MediaType JSON = MediaType.get("application/json");

  private final OkHttpClient httpClient;
  private final CredentialStore credentials;
  private final TokenCache tokens;

  public AiCoreClient(OkHttpClient httpClient, CredentialStore credentials, TokenCache tokens) {
    this.httpClient = httpClient;
    this.credentials = credentials;
    this.tokens = tokens;
  }

  public DeploymentPage listDeployments(String tenant) {
    return call(
        tenant, "GET", "v2/lm/deployments", null, "List deployments", null, DeploymentPage.class);
  }

  public DeploymentDetails getDeployment(String tenant, String deploymentId) {
    return call(
        tenant,
        "GET",
        "v2/lm/deployments/" + segment(deploymentId),
        null,
        "Get deployment",
        deploymentId,
        DeploymentDetails.class);
  }

  public Configurations listConfigurations(String tenant) {
    return call(
        tenant,
        "GET",
        "v2/lm/configurations",
        null,
        "List configurations",
        null,
        Configurations.class);
  }

  public ConfigurationCreated createConfiguration(String tenant, ConfigurationRequest request) {
    return call(
        tenant,
        "POST",
        "v2/lm/configurations",
        request,
        "Create configuration",
        null,
        ConfigurationCreated.class);
  }

  public ScenarioModels listModels(String tenant, String scenarioId) {
    return call(
        tenant,
        "GET",
        "v2/lm/scenarios/" + segment(scenarioId) + "/models",
        null,
        "List models",
        null,
        ScenarioModels.class);
  }

  public DeploymentCreated createDeployment(String tenant, String configurationId, String ttl) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("configurationId", configurationId);
    if (ttl != null && !ttl.isBlank()) {
      body.put("ttl", ttl);
    }
    return call(
        tenant,
        "POST",
        "v2/lm/deployments",
        body,
        "Create deployment",
        null,
        DeploymentCreated.class);
  }

  public DeploymentModified updateDeployment(
      String tenant, String deploymentId, DeploymentModification modification) {
    return call(
        tenant,
        "PATCH",
        "v2/lm/deployments/" + segment(deploymentId),
        modification,
        "Update deployment",
        deploymentId,
        DeploymentModified.class);
  }

  public DeploymentDeleted deleteDeployment(String tenant, String deploymentId) {
    return call(
        tenant,
        "DELETE",
        "v2/lm/deployments/" + segment(deploymentId),
        null,
        "Delete deployment",
        deploymentId,
        DeploymentDeleted.class);
  }

  /**
   * Starts a request to {@code url} with the tenant's authentication headers already set. Used for
   * calls that go to a deployment URL instead of the API base.
   */
  public Request.Builder authorizedRequest(String tenant, @NotNull String url) {
    TenantCredential credential = credentials.get(tenant);
    String token = tokens.getToken(tenant);
    return new Request.Builder()
        .url(url)
        .header("Authorization", "Bearer " + token)
        .header(RESOURCE_GROUP_HEADER, nullToEmpty(credential.resourceGroup()))
        .header("Content-Type", JSON.toString());
  }

  private <T> T call(
      String tenant,
      String method,
      String path,
      Object body,
      String operation,
      String deploymentId,
      Class<T> type) {
    TenantCredential credential = credentials.get(tenant);
    String url = resolve(credential, path);
    RequestBody requestBody =
        body == null ? null : RequestBody.create(JacksonUtility.toJson(body), JSON);
    if (body != null && log.isTraceEnabled()) {
      log.trace(
          "{} for tenant {} payload:\n{}", operation, tenant, JacksonUtility.toPrettyJson(body));
    }
    Request request = authorizedRequest(tenant, url).method(method, requestBody).build();

    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String text = responseBody == null ? "" : responseBody.string();
      if (response.code() == 404 && deploymentId != null) {
        throw new DeploymentNotFoundException(deploymentId);
      }
      if (!response.isSuccessful()) {
        log.error(
            "{} for tenant {} failed with status {}: {}", operation, tenant, response.code(), text);
        throw new UpstreamRequestException(operation, response.code(), text);
      }
      return decode(text, type, operation);
    } catch (IOException e) {
      throw new NetworkException("%s for tenant %s failed".formatted(operation, tenant), e);
    }
  }

  private static <T> T decode(String text, Class<T> type, String operation) {
    try {
      T value = JacksonUtility.getJsonMapper().readValue(text, type);
      if (value == null) {
        throw new IllegalArgumentException("empty body");
      }
      return value;
    } catch (Exception e) {
      throw new DecodeException(operation + " response", e);
    }
  }

  private static String resolve(TenantCredential credential, String path) {
    HttpUrl base = credential.apiBaseUrl() == null ? null : HttpUrl.parse(credential.apiBaseUrl());
    if (base == null) {
      throw new ConfigMissingException(
          "Invalid API URL for tenant %s: %s"
              .formatted(credential.tenantId(), credential.apiBaseUrl()));
    }
    String prefix = base.toString().endsWith("/") ? base.toString() : base + "/";
    return prefix + path;
  }

  private static String segment(String value) {
    return HttpUrl.parse("http://localhost/")
        .newBuilder()
        .addPathSegment(value == null ? "" : value)
        .build()
        .encodedPath()
        .substring(1);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
