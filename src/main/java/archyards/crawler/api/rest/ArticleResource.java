/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.api.rest;

import java.util.List;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import archyards.crawler.api.types.ArticleListType;
import archyards.crawler.api.types.ArticleType;
import archyards.crawler.api.types.SourceCountType;
import archyards.crawler.api.types.TodayArticlesType;
import archyards.crawler.data.models.Article;
import archyards.crawler.observability.LoggingConfig;
import archyards.crawler.services.ArticleFilter;
import archyards.crawler.services.ArticlePage;
import archyards.crawler.services.ArticleQueryService;

/**
 * Read-only REST endpoints over the published collection.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/articles} - filtered, paginated listing</li>
 * <li>{@code GET /api/articles/today} - articles published today</li>
 * <li>{@code GET /api/articles/{id}} - one article</li>
 * <li>{@code GET /api/sources} - published article counts per source</li>
 * </ul>
 *
 * <p>
 * Query parameters are read as strings: a malformed {@code limit} or {@code offset} falls back to its default instead
 * of failing the request, and an unknown {@code badge} does not filter.
 *
 * <p>
 * <b>Response Format</b> ({@code /api/articles}):
 *
 * <pre>
 * {
 *   "total": 42,
 *   "limit": 20,
 *   "offset": 0,
 *   "articles": [ { "id": "3f2a9c0d11be", "source_name": "Dezeen", ... } ]
 * }
 * </pre>
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Articles",
        description = "Published article queries")
public class ArticleResource {

    private static final Logger LOG = Logger.getLogger(ArticleResource.class);

    @Inject
    ArticleQueryService queryService;

    @GET
    @Path("/articles")
    @Operation(
            summary = "List published articles",
            description = "Conjunctive filters over the published collection, in publish order. limit defaults to 20 "
                    + "and is clamped to 100.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Articles returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ArticleListType.class)))})
    public Response listArticles(@Parameter(
            description = "Exact category match",
            example = "architecture") @QueryParam("category") String category,
            @Parameter(
                    description = "aggregated or paid") @QueryParam("badge") String badge,
            @Parameter(
                    description = "Source name, case-insensitive") @QueryParam("source") String source,
            @Parameter(
                    description = "Presence flag: only articles published today") @QueryParam("today") String today,
            @Parameter(
                    description = "Page size (default 20, max 100)",
                    example = "20") @QueryParam("limit") String limit,
            @Parameter(
                    description = "Pagination offset",
                    example = "0") @QueryParam("offset") String offset) {
        LoggingConfig.setRequestOrigin("/api/articles");
        try {
            ArticleFilter filter = new ArticleFilter(category, badge, source, isPresent(today));
            ArticlePage page = queryService.list(filter, limit, offset);
            LOG.debugf("Listed %d of %d articles (limit=%d, offset=%d)", page.articles().size(), page.total(),
                    page.limit(), page.offset());
            return Response.ok(ArticleListType.fromPage(page)).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    @GET
    @Path("/articles/today")
    @Operation(
            summary = "Articles published today",
            description = "Articles whose publish time falls on today's date in the configured zone")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Today's articles",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = TodayArticlesType.class)))})
    public Response todayArticles() {
        List<Article> today = queryService.today();
        return Response.ok(new TodayArticlesType(today.size(), ArticleType.fromArticles(today))).build();
    }

    @GET
    @Path("/articles/{id}")
    @Operation(
            summary = "Get one published article")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Article found",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ArticleType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "No published article with this id")})
    public Response getArticle(@PathParam("id") String id) {
        return queryService.findById(id).map(article -> Response.ok(ArticleType.fromArticle(article)).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                        .entity(new ErrorResponse("Article not found")).build());
    }

    @GET
    @Path("/sources")
    @Operation(
            summary = "Published articles per source",
            description = "Most common source first")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Source counts",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = SourceCountType.class)))})
    public Response sources() {
        List<SourceCountType> counts = queryService.sourceCounts().entrySet().stream()
                .map((Map.Entry<String, Long> e) -> new SourceCountType(e.getKey(), e.getValue())).toList();
        return Response.ok(counts).build();
    }

    private static boolean isPresent(String flag) {
        return flag != null && !"false".equalsIgnoreCase(flag.trim()) && !"0".equals(flag.trim());
    }

    /**
     * Error response DTO.
     */
    public record ErrorResponse(String error) {
    }
}
