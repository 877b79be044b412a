/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.api.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;

import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;

/**
 * HTTP tests for the public query endpoints against an empty published collection.
 */
@QuarkusTest
class ArticleEndpointTest {

    @Test
    void testListArticles_emptyCollection() {
        given().queryParam("limit", "500").when().get("/api/articles").then().statusCode(200)
                .body("total", equalTo(0)).body("limit", equalTo(100)).body("offset", equalTo(0))
                .body("articles.size()", equalTo(0));
    }

    @Test
    void testListArticles_malformedPagination_usesDefaults() {
        given().queryParam("limit", "abc").queryParam("offset", "-3").when().get("/api/articles").then()
                .statusCode(200).body("limit", equalTo(20)).body("offset", equalTo(0));
    }

    @Test
    void testGetArticle_unknownId_returns404() {
        given().when().get("/api/articles/does-not-exist").then().statusCode(404)
                .body("error", equalTo("Article not found"));
    }

    @Test
    void testHealth() {
        given().when().get("/api/health").then().statusCode(200).body("status", equalTo("ok"))
                .body("total_articles", equalTo(0));
    }

    @Test
    void testPipelineStatus_idle() {
        given().when().get("/admin/api/pipeline/status").then().statusCode(200).body("state", equalTo("idle"))
                .body("running", equalTo(false));
    }
}
