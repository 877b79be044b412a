/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.http.Fault;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

/**
 * Base class for tests that fetch feeds and article pages over HTTP.
 *
 * <p>
 * Starts a WireMock server on a random port before each test and stops it afterwards. Feed fixtures may reference the
 * server with the {@code ${base}} placeholder, which {@link #stubFeedFile(String, String)} replaces with
 * {@link #baseUrl()}.
 */
public abstract class WireMockTestBase {

    /** WireMock HTTP server standing in for publishers. */
    protected WireMockServer wireMockServer;

    @BeforeEach
    protected void startWireMock() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
    }

    @AfterEach
    protected void stopWireMock() {
        if (wireMockServer != null && wireMockServer.isRunning()) {
            wireMockServer.resetAll();
            wireMockServer.stop();
        }
    }

    protected String baseUrl() {
        return "http://localhost:" + wireMockServer.port();
    }

    /**
     * Serves a feed fixture from {@code src/test/resources/} at the given path.
     */
    protected void stubFeedFile(String path, String resourcePath) {
        stubFeed(path, loadStubFile(resourcePath).replace("${base}", baseUrl()));
    }

    protected void stubFeed(String path, String body) {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo(path)).willReturn(WireMock.aResponse()
                .withStatus(200).withHeader("Content-Type", "application/rss+xml; charset=utf-8").withBody(body)));
    }

    protected void stubPageFile(String path, String resourcePath) {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo(path)).willReturn(WireMock.aResponse()
                .withStatus(200).withHeader("Content-Type", "text/html; charset=utf-8")
                .withBody(loadStubFile(resourcePath))));
    }

    protected void stubStatus(String path, int status) {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo(path))
                .willReturn(WireMock.aResponse().withStatus(status).withBody("unavailable")));
    }

    protected void stubConnectionReset(String path) {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo(path))
                .willReturn(WireMock.aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));
    }

    /**
     * Loads a fixture from the test classpath.
     *
     * @param resourcePath
     *            path relative to {@code src/test/resources/}
     * @return fixture content
     */
    protected String loadStubFile(String resourcePath) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalStateException("Stub file not found in test resources: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load stub file: " + resourcePath, e);
        }
    }
}
