package com.codeheadsystems.gplot.server.resource;

import com.codeheadsystems.gplot.model.render.RenderRequest;
import com.codeheadsystems.gplot.model.render.RenderResponse;
import com.codeheadsystems.gplot.server.exceptions.SanitizationException;
import com.codeheadsystems.gplot.server.exceptions.StorageException;
import com.codeheadsystems.gplot.server.exceptions.ValidationException;
import com.codeheadsystems.gplot.server.manager.RenderManager;
import com.codeheadsystems.gplot.server.security.SecurityAuditor;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for {@code POST /render}. Delegates to {@link RenderManager}.
 */
@Path("/render")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@PermitAll
public class RenderResource {

  private static final Logger log = LoggerFactory.getLogger(RenderResource.class);

  private final RenderManager renderManager;
  private final SecurityAuditor auditor;

  public RenderResource(RenderManager renderManager, SecurityAuditor auditor) {
    this.renderManager = renderManager;
    this.auditor = auditor;
  }

  @POST
  public RenderResponse render(RenderRequest req,
                               @Context SecurityContext securityContext,
                               @Context ContainerRequestContext request) {
    log.debug("render()");
    try {
      return renderManager.render(req, RequestContexts.group(securityContext));
    } catch (SanitizationException e) {
      auditor.logSanitizationFailure(RequestContexts.clientAddress(request), "render_request",
          e.getMessage(), "/render");
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (ValidationException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (StorageException e) {
      log.error("Storage failure while saving render", e);
      throw new WebApplicationException("Internal storage error", Response.Status.INTERNAL_SERVER_ERROR);
    }
  }
}
