package com.attribution.consolidation.rest;

import com.attribution.consolidation.api.AttributionService;
import com.attribution.consolidation.api.ConsolidationOptions;
import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.attribution.consolidation.core.model.ConfidenceLevel;
import com.attribution.consolidation.rest.dto.AttributionResponse;
import com.attribution.consolidation.rest.dto.BatchAttributionRequest;
import com.attribution.consolidation.rest.dto.BatchAttributionResponse;
import com.attribution.consolidation.rest.dto.ConsolidationResponse;
import com.attribution.consolidation.rest.dto.ErrorResponse;
import com.attribution.consolidation.rest.dto.StatisticsResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST resource for attribution queries.
 *
 * <p>Invalid input maps to 400 with an {@link ErrorResponse}; an address no source knows maps to 404.</p>
 */
@Path("/api/v1/attributions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Attribution", description = "Consolidated cross-source attribution of blockchain addresses")
public class AttributionResource {
    private static final Logger log = LoggerFactory.getLogger(AttributionResource.class);
    private static final String BASE_PATH = "/api/v1/attributions";
    private static final String INTERNAL_ERROR_MESSAGE = "An internal error occurred. Check server logs for details.";

    private final AttributionService service;

    @Inject
    public AttributionResource(AttributionService service) {
        this.service = service;
    }

    /**
     * GET /api/v1/attributions/{blockchain}/{address}
     */
    @GET
    @Path("/{blockchain}/{address}")
    @Operation(summary = "Get the consolidated attribution of an address",
            description = "Queries every enabled source, weighs their claims and returns one verdict.")
    @APIResponse(responseCode = "200", description = "Consolidated attribution")
    @APIResponse(responseCode = "400", description = "Invalid address, blockchain, source or confidence")
    @APIResponse(responseCode = "404", description = "No source attributes the address at the requested confidence")
    public Response getAttribution(
            @PathParam("blockchain") String blockchain,
            @PathParam("address") String address,
            @Parameter(description = "Comma-separated source names") @QueryParam("sources") String sources,
            @Parameter(description = "Minimum overall confidence, e.g. high") @QueryParam("minConfidence") String minConfidence) {
        String path = BASE_PATH + "/" + blockchain + "/" + address;
        try {
            ConsolidationOptions options = service.getDefaultOptions().toBuilder()
                    .sources(parseSources(sources))
                    .minConfidence(parseConfidence(minConfidence))
                    .build();
            Optional<AttributionConsolidation> result = service.getAttribution(address, blockchain, options);
            if (result.isEmpty()) {
                return Response.status(Response.Status.NOT_FOUND)
                        .entity(ErrorResponse.notFound("No attribution found for address: " + address, path))
                        .build();
            }
            return Response.ok(ConsolidationResponse.from(result.get())).build();
        } catch (IllegalArgumentException e) {
            return badRequest(e, path);
        } catch (Exception e) {
            log.error("getAttribution.failed address={} blockchain={} error={}", address, blockchain, e.getMessage(), e);
            return internalError(path);
        }
    }

    /**
     * POST /api/v1/attributions/batch
     */
    @POST
    @Path("/batch")
    @Operation(summary = "Consolidate a batch of addresses",
            description = "Consolidates up to the configured maximum of addresses with bounded concurrency.")
    @APIResponse(responseCode = "200", description = "One entry per distinct address; null where nothing was found")
    @APIResponse(responseCode = "400", description = "Invalid batch")
    public Response batch(BatchAttributionRequest request) {
        String path = BASE_PATH + "/batch";
        try {
            if (request == null) {
                throw new IllegalArgumentException("Request body is required");
            }
            ConsolidationOptions.Builder options = service.getDefaultOptions().toBuilder()
                    .sources(request.sources())
                    .minConfidence(parseConfidence(request.minConfidence()));
            if (request.maxConcurrent() != null) {
                options.maxConcurrent(request.maxConcurrent());
            }

            long start = System.nanoTime();
            Map<String, AttributionConsolidation> results =
                    service.consolidateMany(request.addresses(), request.blockchain(), options.build());

            Map<String, ConsolidationResponse> body = new LinkedHashMap<>();
            List<String> unattributed = new ArrayList<>();
            results.forEach((address, consolidation) -> {
                body.put(address, consolidation != null ? ConsolidationResponse.from(consolidation) : null);
                if (consolidation == null) {
                    unattributed.add(address);
                }
            });
            return Response.ok(new BatchAttributionResponse(
                    body,
                    results.size(),
                    results.size() - unattributed.size(),
                    unattributed,
                    (System.nanoTime() - start) / 1_000_000
            )).build();
        } catch (IllegalArgumentException e) {
            return badRequest(e, path);
        } catch (Exception e) {
            log.error("batch.failed error={}", e.getMessage(), e);
            return internalError(path);
        }
    }

    /**
     * GET /api/v1/attributions/search/entity
     */
    @GET
    @Path("/search/entity")
    @Operation(summary = "Search attributions by entity",
            description = "Returns persisted attributions naming the entity, newest first.")
    @APIResponse(responseCode = "200", description = "Matching attributions")
    @APIResponse(responseCode = "400", description = "Invalid entity, blockchain, confidence or limit")
    public Response searchByEntity(
            @QueryParam("entity") String entity,
            @QueryParam("blockchain") String blockchain,
            @QueryParam("confidence") String confidence,
            @QueryParam("limit") @DefaultValue("100") int limit) {
        String path = BASE_PATH + "/search/entity";
        try {
            List<AttributionResponse> results = service
                    .searchByEntity(entity, blockchain, parseConfidence(confidence), limit)
                    .stream()
                    .map(AttributionResponse::from)
                    .toList();
            return Response.ok(results).build();
        } catch (IllegalArgumentException e) {
            return badRequest(e, path);
        } catch (Exception e) {
            log.error("searchByEntity.failed entity='{}' error={}", entity, e.getMessage(), e);
            return internalError(path);
        }
    }

    /**
     * GET /api/v1/attributions/statistics
     */
    @GET
    @Path("/statistics")
    @Operation(summary = "Attribution statistics",
            description = "Aggregate counts over the records persisted in the last N days.")
    @APIResponse(responseCode = "200", description = "Statistics")
    @APIResponse(responseCode = "400", description = "Window outside 1..365 days")
    public Response statistics(@QueryParam("days") @DefaultValue("30") int days) {
        String path = BASE_PATH + "/statistics";
        try {
            return Response.ok(StatisticsResponse.from(service.getStatistics(days))).build();
        } catch (IllegalArgumentException e) {
            return badRequest(e, path);
        } catch (Exception e) {
            log.error("statistics.failed days={} error={}", days, e.getMessage(), e);
            return internalError(path);
        }
    }

    /**
     * GET /api/v1/attributions/conflicts
     */
    @GET
    @Path("/conflicts")
    @Operation(summary = "Consolidations with conflicting sources")
    @APIResponse(responseCode = "200", description = "Conflicting consolidations, newest first")
    @APIResponse(responseCode = "400", description = "Unsupported blockchain")
    public Response conflicts(@QueryParam("blockchain") String blockchain) {
        String path = BASE_PATH + "/conflicts";
        try {
            List<ConsolidationResponse> results = service.findConflicts(blockchain).stream()
                    .map(ConsolidationResponse::from)
                    .toList();
            return Response.ok(results).build();
        } catch (IllegalArgumentException e) {
            return badRequest(e, path);
        } catch (Exception e) {
            log.error("conflicts.failed blockchain={} error={}", blockchain, e.getMessage(), e);
            return internalError(path);
        }
    }

    /**
     * GET /api/v1/attributions/sources
     */
    @GET
    @Path("/sources")
    @Operation(summary = "Registered sources and their consensus weights")
    @APIResponse(responseCode = "200", description = "Source name to weight")
    public Response sources() {
        return Response.ok(service.getSources()).build();
    }

    /**
     * DELETE /api/v1/attributions/cache
     */
    @DELETE
    @Path("/cache")
    @Operation(summary = "Clear the consolidation cache")
    @APIResponse(responseCode = "204", description = "Cache cleared")
    public Response clearCache() {
        service.clearCache();
        return Response.noContent().build();
    }

    /**
     * DELETE /api/v1/attributions/cache/{blockchain}/{address}
     */
    @DELETE
    @Path("/cache/{blockchain}/{address}")
    @Operation(summary = "Invalidate cached results for one address")
    @APIResponse(responseCode = "200", description = "Number of entries removed")
    @APIResponse(responseCode = "400", description = "Invalid address or blockchain")
    public Response invalidate(@PathParam("blockchain") String blockchain,
                               @PathParam("address") String address) {
        String path = BASE_PATH + "/cache/" + blockchain + "/" + address;
        try {
            int removed = service.invalidate(address, blockchain);
            return Response.ok(Map.of("invalidated", removed)).build();
        } catch (IllegalArgumentException e) {
            return badRequest(e, path);
        }
    }

    // ========== Helpers ==========

    static List<String> parseSources(String sources) {
        if (sources == null || sources.isBlank()) {
            return List.of();
        }
        return Arrays.stream(sources.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    static ConfidenceLevel parseConfidence(String confidence) {
        if (confidence == null || confidence.isBlank()) {
            return null;
        }
        return ConfidenceLevel.fromWireName(confidence);
    }

    private static Response badRequest(IllegalArgumentException e, String path) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(ErrorResponse.badRequest(e.getMessage(), path))
                .build();
    }

    private static Response internalError(String path) {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError(INTERNAL_ERROR_MESSAGE, path))
                .build();
    }
}
