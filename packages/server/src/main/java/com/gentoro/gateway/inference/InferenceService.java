package com.gentoro.gateway.inference;

import com.gentoro.gateway.deployment.AiCoreClient;
import com.gentoro.gateway.deployment.DeploymentAggregator;
import com.gentoro.gateway.deployment.model.Deployment;
import com.gentoro.gateway.deployment.model.DeploymentListing;
import com.gentoro.gateway.exception.DeploymentNotFoundException;
import com.gentoro.gateway.exception.ExceptionUtil;
import com.gentoro.gateway.exception.NetworkException;
import com.gentoro.gateway.exception.StateException;
import com.gentoro.gateway.exception.UpstreamRequestException;
import com.gentoro.gateway.inference.protocol.InferenceTarget;
import com.gentoro.gateway.inference.protocol.OutboundRequest;
import com.gentoro.gateway.inference.protocol.ProtocolAdapter;
import com.gentoro.gateway.tenancy.TenantScope;
import com.gentoro.gateway.utility.JacksonUtility;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Runs chat inference against a deployment inside the caller's scope.
 *
 * <p>The deployment is located through the aggregated listing, which also tells which tenant owns
 * it. Its protocol is classified, the conversation trimmed to the model's budget, and the request
 * sent with the owning tenant's credentials.
 */
public class InferenceService {
  private static final org.slf4j.Logger log =
      com.gentoro.gateway.logging.LoggingService.getLogger(InferenceService.class);

  private final DeploymentAggregator aggregator;
  private final AiCoreClient client;
  private final OkHttpClient inferenceClient;
  private final Map<InferenceProtocol, ProtocolAdapter> adapters;

  public InferenceService(
      DeploymentAggregator aggregator,
      AiCoreClient client,
      OkHttpClient inferenceClient,
      Map<InferenceProtocol, ProtocolAdapter> adapters) {
    this.aggregator = aggregator;
    this.client = client;
    this.inferenceClient = inferenceClient;
    this.adapters = adapters;
  }

  private record Call(
      String tenant, InferenceTarget target, ProtocolAdapter adapter, OutboundRequest outbound) {
    String url() {
      return outbound.url(target.deploymentUrl());
    }
  }

  public InferenceResponse chat(TenantScope scope, InferenceRequest request) {
    Call call = prepare(scope, request, false);
    try (Response response = inferenceClient.newCall(httpRequest(call)).execute()) {
      String body = bodyOf(response);
      if (!response.isSuccessful()) {
        throw failed(call, response.code(), body);
      }
      return call.adapter().parse(body, call.target());
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          t ->
              new NetworkException(
                  "Inference call to deployment %s failed".formatted(call.target().deploymentId()),
                  t));
    }
  }

  public void stream(TenantScope scope, InferenceRequest request, StreamSink sink) {
    Call call = prepare(scope, request, true);
    try (Response response = inferenceClient.newCall(httpRequest(call)).execute()) {
      if (!response.isSuccessful()) {
        throw failed(call, response.code(), bodyOf(response));
      }
      ResponseBody body = response.body();
      if (body == null) {
        sink.send(StreamRelay.frame(StreamRelay.DONE));
        return;
      }
      int chunks = StreamRelay.relay(body.source(), call.adapter(), call.target(), sink);
      log.debug("Relayed {} chunk(s) from deployment {}", chunks, call.target().deploymentId());
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          t ->
              new NetworkException(
                  "Streaming from deployment %s failed".formatted(call.target().deploymentId()),
                  t));
    }
  }

  private Call prepare(TenantScope scope, InferenceRequest request, boolean streaming) {
    request.validate();
    DeploymentListing listing = aggregator.listDeployments(scope);
    DeploymentListing.Located located =
        listing
            .find(request.deploymentId())
            .orElseThrow(() -> new DeploymentNotFoundException(request.deploymentId()));
    Deployment deployment = located.deployment();
    if (deployment.deploymentUrl() == null || deployment.deploymentUrl().isBlank()) {
      throw new StateException(
          "Deployment URL not available for deployment " + deployment.id());
    }

    InferenceTarget target = InferenceTarget.of(deployment);
    InferenceProtocol protocol = ProtocolClassifier.classify(deployment);
    ProtocolAdapter adapter = adapters.get(protocol);
    if (adapter == null) {
      throw new StateException("No adapter for protocol " + protocol);
    }
    List<InferenceMessage> trimmed =
        ContextWindowTrimmer.trim(request.messages(), target.modelNameOrEmpty());
    if (trimmed.size() < request.messages().size()) {
      log.debug(
          "Trimmed conversation from {} to {} message(s) for model '{}'",
          request.messages().size(),
          trimmed.size(),
          target.modelNameOrEmpty());
    }
    OutboundRequest outbound = adapter.build(target, request.withMessages(trimmed), streaming);
    log.info(
        "Inference on deployment {} of tenant {} via {} (model '{}', streaming={})",
        deployment.id(),
        located.tenant(),
        protocol,
        target.modelNameOrEmpty(),
        streaming);
    if (log.isTraceEnabled()) {
      log.trace("Outbound payload:\n{}", JacksonUtility.toPrettyJson(outbound.payload()));
    }
    return new Call(located.tenant(), target, adapter, outbound);
  }

  private Request httpRequest(Call call) {
    RequestBody body =
        RequestBody.create(JacksonUtility.toJson(call.outbound().payload()), AiCoreClient.JSON);
    return client.authorizedRequest(call.tenant(), call.url()).post(body).build();
  }

  private static String bodyOf(Response response) throws IOException {
    ResponseBody body = response.body();
    return body == null ? "" : body.string();
  }

  private static UpstreamRequestException failed(Call call, int status, String body) {
    log.error(
        "Inference on deployment {} failed with status {}: {}",
        call.target().deploymentId(),
        status,
        body);
    return new UpstreamRequestException("Inference request", status, body);
  }
}
