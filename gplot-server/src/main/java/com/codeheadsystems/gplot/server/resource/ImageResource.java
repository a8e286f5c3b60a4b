package com.codeheadsystems.gplot.server.resource;

import com.codeheadsystems.gplot.model.image.ImageListResponse;
import com.codeheadsystems.gplot.model.image.PurgeRequest;
import com.codeheadsystems.gplot.model.image.PurgeResponse;
import com.codeheadsystems.gplot.server.exceptions.PermissionDeniedException;
import com.codeheadsystems.gplot.server.exceptions.StorageException;
import com.codeheadsystems.gplot.server.exceptions.ValidationException;
import com.codeheadsystems.gplot.server.security.SecurityAuditor;
import com.codeheadsystems.gplot.server.storage.ImageStorage;
import com.codeheadsystems.gplot.server.storage.StoredImage;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for stored images, scoped to the caller's group.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code GET /images}: guids visible to the caller</li>
 *   <li>{@code GET /images/{guid}}: image bytes</li>
 *   <li>{@code DELETE /images/{guid}}: delete an image</li>
 *   <li>{@code POST /images/purge}: delete images older than a number of days</li>
 * </ul>
 * Malformed guids answer 400, another group's image 403 (audited), a missing image 404.
 */
@Path("/images")
@Produces(MediaType.APPLICATION_JSON)
@PermitAll
public class ImageResource {

  private static final Logger log = LoggerFactory.getLogger(ImageResource.class);

  private static final Map<String, String> MEDIA_TYPES = Map.of(
      "png", "image/png",
      "jpg", "image/jpeg",
      "jpeg", "image/jpeg",
      "svg", "image/svg+xml",
      "pdf", "application/pdf");

  private final ImageStorage imageStorage;
  private final SecurityAuditor auditor;

  public ImageResource(ImageStorage imageStorage, SecurityAuditor auditor) {
    this.imageStorage = imageStorage;
    this.auditor = auditor;
  }

  @GET
  public ImageListResponse list(@Context SecurityContext securityContext) {
    String group = RequestContexts.group(securityContext);
    return call(() -> new ImageListResponse(imageStorage.listImages(group)));
  }

  @GET
  @Path("/{guid}")
  @Produces(MediaType.WILDCARD)
  public Response get(@PathParam("guid") String guid,
                      @Context SecurityContext securityContext,
                      @Context ContainerRequestContext request) {
    log.debug("get({})", guid);
    String group = RequestContexts.group(securityContext);
    Optional<StoredImage> image = guarded(guid, "read", group, request,
        () -> imageStorage.getImage(guid, group));
    StoredImage found = image.orElseThrow(
        () -> new WebApplicationException("Image not found", Response.Status.NOT_FOUND));
    return Response.ok(found.data(), MEDIA_TYPES.getOrDefault(found.format(), MediaType.APPLICATION_OCTET_STREAM))
        .build();
  }

  @DELETE
  @Path("/{guid}")
  public Response delete(@PathParam("guid") String guid,
                         @Context SecurityContext securityContext,
                         @Context ContainerRequestContext request) {
    log.debug("delete({})", guid);
    String group = RequestContexts.group(securityContext);
    boolean deleted = guarded(guid, "delete", group, request, () -> imageStorage.deleteImage(guid, group));
    if (!deleted) {
      throw new WebApplicationException("Image not found", Response.Status.NOT_FOUND);
    }
    return Response.noContent().build();
  }

  /**
   * Purges the caller's images older than {@code ageDays}; 0 purges all of them. An
   * unauthenticated caller purges across all groups.
   */
  @POST
  @Path("/purge")
  @Consumes(MediaType.APPLICATION_JSON)
  public PurgeResponse purge(PurgeRequest req, @Context SecurityContext securityContext) {
    if (req == null || req.ageDays() == null) {
      throw new WebApplicationException("ageDays is required", Response.Status.BAD_REQUEST);
    }
    int ageDays = req.ageDays();
    if (ageDays < 0) {
      throw new WebApplicationException("ageDays must be zero or positive", Response.Status.BAD_REQUEST);
    }
    String group = RequestContexts.group(securityContext);
    return call(() -> new PurgeResponse(imageStorage.purge(ageDays, group)));
  }

  private <T> T guarded(String guid, String action, String group, ContainerRequestContext request,
                        Supplier<T> operation) {
    try {
      return call(operation);
    } catch (PermissionDeniedException e) {
      auditor.logPermissionDenied(RequestContexts.clientAddress(request), "image/" + guid, action,
          "/images");
      log.debug("Group {} denied {} on {}", group, action, guid);
      throw new WebApplicationException("Access denied", Response.Status.FORBIDDEN);
    }
  }

  private static <T> T call(Supplier<T> operation) {
    try {
      return operation.get();
    } catch (PermissionDeniedException e) {
      throw e;
    } catch (ValidationException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (StorageException e) {
      log.error("Storage failure", e);
      throw new WebApplicationException("Internal storage error", Response.Status.INTERNAL_SERVER_ERROR);
    }
  }
}
