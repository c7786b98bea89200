package com.slack.distributor.query;

import com.slack.distributor.errors.MissingTenantException;
import io.grpc.Context;

/** Carries the tenant ("org") id of a request on the gRPC context. */
public final class TenantContext {
  public static final Context.Key<String> TENANT_ID = Context.key("tenant-id");

  private TenantContext() {}

  public static Context withTenantId(Context context, String tenantId) {
    return context.withValue(TENANT_ID, tenantId);
  }

  public static String extractTenantId(Context context) {
    String tenantId = TENANT_ID.get(context);
    if (tenantId == null || tenantId.isBlank()) {
      throw new MissingTenantException("no tenant id found in request context");
    }
    return tenantId;
  }
}
