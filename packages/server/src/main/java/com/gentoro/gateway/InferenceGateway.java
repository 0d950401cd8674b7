package com.gentoro.gateway;

import com.gentoro.gateway.attachment.AttachmentEncoder;
import com.gentoro.gateway.attachment.EncodedAttachment;
import com.gentoro.gateway.credentials.ConfigurationCredentialSource;
import com.gentoro.gateway.credentials.CredentialStore;
import com.gentoro.gateway.credentials.LazyCredentialStore;
import com.gentoro.gateway.deployment.AiCoreClient;
import com.gentoro.gateway.deployment.DeploymentAggregator;
import com.gentoro.gateway.deployment.model.ConfigurationCreated;
import com.gentoro.gateway.deployment.model.ConfigurationRequest;
import com.gentoro.gateway.deployment.model.Configurations;
import com.gentoro.gateway.deployment.model.DeploymentCreated;
import com.gentoro.gateway.deployment.model.DeploymentDeleted;
import com.gentoro.gateway.deployment.model.DeploymentDetails;
import com.gentoro.gateway.deployment.model.DeploymentListing;
import com.gentoro.gateway.deployment.model.DeploymentModification;
import com.gentoro.gateway.deployment.model.DeploymentModified;
import com.gentoro.gateway.deployment.model.DeploymentRequest;
import com.gentoro.gateway.deployment.model.ScenarioModels;
import com.gentoro.gateway.exception.DeploymentAccessDeniedException;
import com.gentoro.gateway.exception.ValidationException;
import com.gentoro.gateway.http.OkHttpFactory;
import com.gentoro.gateway.inference.InferenceRequest;
import com.gentoro.gateway.inference.InferenceResponse;
import com.gentoro.gateway.inference.InferenceService;
import com.gentoro.gateway.inference.StreamSink;
import com.gentoro.gateway.inference.protocol.ProtocolAdapterFactory;
import com.gentoro.gateway.tenancy.CallerDescription;
import com.gentoro.gateway.tenancy.CallerIdentity;
import com.gentoro.gateway.tenancy.OrganizationDirectory;
import com.gentoro.gateway.tenancy.TenantResolver;
import com.gentoro.gateway.tenancy.TenantScope;
import com.gentoro.gateway.token.InMemoryTokenStore;
import com.gentoro.gateway.token.OAuthTokenClient;
import com.gentoro.gateway.token.TokenCache;
import java.time.Clock;
import java.time.Duration;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;
import org.jetbrains.annotations.Nullable;

/**
 * Caller-facing entry point of the gateway; wires every component from configuration.
 *
 * <p>Lifecycle operations act on a single tenant: the caller's own team when {@code tenant} is
 * {@code null}, otherwise the named tenant, which must be inside the caller's scope.
 */
public class InferenceGateway implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.gateway.logging.LoggingService.getLogger(InferenceGateway.class);

  private final Configuration configuration;
  private final TenantResolver resolver;
  private final AiCoreClient client;
  private final DeploymentAggregator aggregator;
  private final InferenceService inference;
  private final OkHttpClient metadataClient;

  public InferenceGateway(Configuration configuration, OrganizationDirectory directory) {
    this.configuration = configuration;
    CredentialStore credentials =
        new LazyCredentialStore(new ConfigurationCredentialSource(configuration));
    this.metadataClient = OkHttpFactory.createMetadataClient(configuration);
    OkHttpClient inferenceClient =
        OkHttpFactory.createInferenceClient(metadataClient, configuration);

    TokenCache tokens =
        new TokenCache(
            credentials,
            new OAuthTokenClient(metadataClient),
            new InMemoryTokenStore(),
            Clock.systemUTC(),
            Duration.ofSeconds(
                configuration.getLong(
                    "gateway.token.safety-margin-seconds",
                    TokenCache.DEFAULT_SAFETY_MARGIN.getSeconds())));
    this.client = new AiCoreClient(metadataClient, credentials, tokens);
    this.aggregator = new DeploymentAggregator(client, configuration);
    this.resolver =
        new TenantResolver(directory, credentials, TenantResolver.teamLimit(configuration));
    this.inference =
        new InferenceService(
            aggregator, client, inferenceClient, ProtocolAdapterFactory.createAll(configuration));
  }

  /** Loads configuration from {@code location}, applies log levels and builds the gateway. */
  public static InferenceGateway create(String location, OrganizationDirectory directory) {
    Configuration configuration = new ConfigurationProvider(location).config();
    com.gentoro.gateway.logging.LoggingService.applyConfiguration(configuration);
    InferenceGateway gateway = new InferenceGateway(configuration, directory);
    log.info("Inference gateway initialized from {}", location);
    return gateway;
  }

  public Configuration configuration() {
    return configuration;
  }

  public DeploymentListing listDeployments(CallerIdentity identity) {
    return aggregator.listDeployments(resolver.resolve(identity));
  }

  public CallerDescription describeCaller(CallerIdentity identity) {
    return new CallerDescription(identity.username(), resolver.resolveUsable(identity).tenants());
  }

  public DeploymentDetails getDeploymentDetails(
      CallerIdentity identity, @Nullable String tenant, String deploymentId) {
    requireText(deploymentId, "deploymentId");
    return client.getDeployment(targetTenant(identity, tenant), deploymentId);
  }

  public Configurations listConfigurations(CallerIdentity identity, @Nullable String tenant) {
    return client.listConfigurations(targetTenant(identity, tenant));
  }

  public ConfigurationCreated createConfiguration(
      CallerIdentity identity, @Nullable String tenant, ConfigurationRequest request) {
    if (request == null) throw new ValidationException("Configuration request is required");
    request.validate();
    return client.createConfiguration(targetTenant(identity, tenant), request);
  }

  public ScenarioModels listModels(
      CallerIdentity identity, @Nullable String tenant, String scenarioId) {
    requireText(scenarioId, "scenarioId");
    return client.listModels(targetTenant(identity, tenant), scenarioId);
  }

  /** Deploys an existing configuration, or creates the configuration first and deploys it. */
  public DeploymentCreated createDeployment(
      CallerIdentity identity, @Nullable String tenant, DeploymentRequest request) {
    if (request == null) throw new ValidationException("Deployment request is required");
    request.validate();
    String target = targetTenant(identity, tenant);
    String configurationId = request.configurationId();
    if (request.configurationRequest() != null) {
      ConfigurationCreated created =
          client.createConfiguration(target, request.configurationRequest());
      log.info("Created configuration {} for new deployment on tenant {}", created.id(), target);
      configurationId = created.id();
    }
    return client.createDeployment(target, configurationId, request.ttl());
  }

  public DeploymentModified updateDeployment(
      CallerIdentity identity,
      @Nullable String tenant,
      String deploymentId,
      DeploymentModification modification) {
    requireText(deploymentId, "deploymentId");
    if (modification == null) throw new ValidationException("Modification is required");
    return client.updateDeployment(targetTenant(identity, tenant), deploymentId, modification);
  }

  public DeploymentDeleted deleteDeployment(
      CallerIdentity identity, @Nullable String tenant, String deploymentId) {
    requireText(deploymentId, "deploymentId");
    return client.deleteDeployment(targetTenant(identity, tenant), deploymentId);
  }

  public InferenceResponse chat(CallerIdentity identity, InferenceRequest request) {
    return inference.chat(resolver.resolve(identity), request);
  }

  public void streamChat(CallerIdentity identity, InferenceRequest request, StreamSink sink) {
    inference.stream(resolver.resolve(identity), request, sink);
  }

  public EncodedAttachment encodeAttachment(String filename, byte[] content) {
    return AttachmentEncoder.encode(filename, content);
  }

  private String targetTenant(CallerIdentity identity, @Nullable String tenant) {
    if (tenant == null || tenant.isBlank()) {
      return resolver.resolveHomeTenant(identity);
    }
    TenantScope scope = resolver.resolve(identity);
    if (!scope.contains(tenant)) {
      throw new DeploymentAccessDeniedException(identity.username(), tenant);
    }
    return tenant;
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(name + " is required");
    }
  }

  @Override
  public void close() {
    aggregator.close();
    metadataClient.dispatcher().executorService().shutdown();
    metadataClient.connectionPool().evictAll();
  }
}
