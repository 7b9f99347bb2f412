package com.cineplexx.rss.sync.render;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.model.CatalogEntry;
import com.cineplexx.rss.sync.model.SessionSlot;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupPageRendererTest {
    private static final LocalDate DAY = LocalDate.of(2026, 1, 5);

    private MockWebServer server;
    private JsoupPageRenderer renderer;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        SyncProperties properties = new SyncProperties();
        properties.setBaseUrl(server.url("/").toString());
        properties.setRenderTimeoutSeconds(1);
        renderer = new JsoupPageRenderer(properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void listingCollectsFilmLinksOncePerCanonicalUrl() throws Exception {
        server.enqueue(html("""
            <html><body>
              <a href="/film/dune?date=2026-01-05">Dune: Part Two</a>
              <a href="/film/dune">  Dune   again </a>
              <a href="/film/up"><img src="up.jpg" alt="Up"></a>
              <a href="/film/x">A</a>
              <a href="/cinemas">Cinemas</a>
            </body></html>
            """));

        RenderResult<List<CatalogEntry>> result = renderer.renderListing("0", DAY);

        assertThat(result.isSuccessful()).isTrue();
        String base = server.url("/").toString().replaceAll("/$", "");
        assertThat(result.value()).containsExactly(
            new CatalogEntry("Dune: Part Two", base + "/film/dune"),
            new CatalogEntry("Up", base + "/film/up")
        );
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/cinemas?location=0&date=2026-01-05");
        assertThat(request.getHeader("User-Agent")).startsWith("Mozilla/5.0");
    }

    @Test
    void descriptionJoinsParagraphsWithBlankLines() {
        server.enqueue(html("""
            <div class="b-movie-description">
              <p class="b-movie-description__text">First   paragraph.</p>
              <p class="b-movie-description__text"> </p>
              <p class="b-movie-description__text">Second
                 paragraph.</p>
            </div>
            """));

        RenderResult<String> result = renderer.renderDescription(server.url("/film/dune").toString());

        assertThat(result.value()).isEqualTo("First paragraph.\n\nSecond paragraph.");
    }

    @Test
    void descriptionFallsBackToContainerText() {
        server.enqueue(html("<div class=\"b-movie-description\"> Only   container text </div>"));

        assertThat(renderer.renderDescription(server.url("/film/dune").toString()).value())
            .isEqualTo("Only container text");
    }

    @Test
    void scheduleParsesSessionItems() throws Exception {
        server.enqueue(html("""
            <a class="b-entity-content__title" href="/cinema">Cineplexx Podgorica</a>
            <div id="data-cineplexx-delta">
              <ul>
                <li data-session-id="s-1">
                  <p class="l-tickets__item-time">18:30</p>
                  <p class="l-tickets__item-cinema">Sala 3</p>
                  <p class="l-tickets__item-info"></p>
                  <p class="l-tickets__item-info">2D, SINH</p>
                  <a href="/tickets/s-1">Buy</a>
                </li>
              </ul>
            </div>
            <ul>
              <li data-session-id="s-2">
                <p class="l-tickets__item-time">21:00</p>
              </li>
            </ul>
            """));

        String filmUrl = server.url("/film/dune").toString();
        RenderResult<List<SessionSlot>> result = renderer.renderSchedule(filmUrl, DAY, "0");

        assertThat(result.value()).hasSize(2);
        SessionSlot first = result.value().get(0);
        assertThat(first.date()).isEqualTo(DAY);
        assertThat(first.time()).isEqualTo("18:30");
        assertThat(first.hall()).isEqualTo("Sala 3");
        assertThat(first.info()).isEqualTo("2D, SINH");
        assertThat(first.sessionId()).isEqualTo("s-1");
        assertThat(first.venueName()).isEqualTo("cineplexx delta");
        assertThat(first.purchaseUrl()).isEqualTo(server.url("/tickets/s-1").toString());

        SessionSlot second = result.value().get(1);
        assertThat(second.venueName()).isEqualTo("Cineplexx Podgorica");
        assertThat(second.purchaseUrl()).isEmpty();

        assertThat(server.takeRequest().getPath()).isEqualTo("/film/dune?date=2026-01-05&location=0");
    }

    @Test
    void httpErrorsBecomeErrorCodes() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));

        RenderResult<String> result = renderer.renderDescription(server.url("/film/dune").toString());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorCode()).isEqualTo(RenderResult.HTTP_ERROR);
        assertThat(result.valueOr("")).isEmpty();
    }

    @Test
    void readTimeoutBecomesTimeoutCode() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        RenderResult<List<SessionSlot>> result = renderer.renderSchedule(server.url("/film/dune").toString(), DAY, "0");

        assertThat(result.errorCode()).isEqualTo(RenderResult.TIMEOUT);
        assertThat(result.valueOr(List.of())).isEmpty();
    }

    @Test
    void unreachableHostBecomesNavigationError() throws Exception {
        MockWebServer closed = new MockWebServer();
        closed.start();
        String url = closed.url("/film/dune").toString();
        closed.shutdown();

        RenderResult<String> result = renderer.renderDescription(url);

        assertThat(result.errorCode()).isEqualTo(RenderResult.NAVIGATION_ERROR);
    }

    private static MockResponse html(String body) {
        return new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html; charset=utf-8")
            .setBody(body);
    }
}
