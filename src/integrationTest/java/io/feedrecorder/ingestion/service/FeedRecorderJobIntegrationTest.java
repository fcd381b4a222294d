package io.feedrecorder.ingestion.service;

import com.github.tomakehurst.wiremock.client.ResponseDefinitionBuilder;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import io.feedrecorder.ingestion.dto.FeedRecord;
import io.feedrecorder.ingestion.store.CsvRecordCodec;
import io.feedrecorder.ingestion.store.JsonRecordCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;

@ActiveProfiles("integration")
@SpringBootTest
class FeedRecorderJobIntegrationTest {

    private static final String NEWS_RSS = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0">
              <channel>
                <title>World News</title>
                <link>https://news.example.com/</link>
                <description>Latest</description>
                <item>
                  <title>Summit opens</title>
                  <link>https://news.example.com/summit-opens</link>
                  <author>desk@news.example.com</author>
                  <pubDate>Tue, 03 Jan 2006 09:00:00 +0000</pubDate>
                  <category>World</category>
                </item>
                <item>
                  <title>Markets close higher</title>
                  <link>https://news.example.com/markets-close</link>
                  <pubDate>Wed, 04 Jan 2006 18:30:00 +0000</pubDate>
                </item>
              </channel>
            </rss>
            """;

    private static final String BLOG_ATOM = """
            <?xml version="1.0" encoding="UTF-8"?>
            <feed xmlns="http://www.w3.org/2005/Atom">
              <title>Engineering Blog</title>
              <id>urn:uuid:2b8d6f8e-0000-4000-8000-000000000001</id>
              <updated>2006-01-05T12:00:00Z</updated>
              <entry>
                <title>Shipping faster</title>
                <id>urn:uuid:2b8d6f8e-0000-4000-8000-000000000002</id>
                <link rel="alternate" href="https://blog.example.com/shipping-faster"/>
                <published>2006-01-05T12:00:00Z</published>
                <updated>2006-01-05T12:00:00Z</updated>
                <author><name>Alex Kim</name></author>
              </entry>
            </feed>
            """;

    @RegisterExtension
    static WireMockExtension wireMockServer = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    @TempDir
    Path tempDir;

    @Autowired
    private FeedRecorderJob feedRecorderJob;

    private final JsonRecordCodec jsonCodec = new JsonRecordCodec();
    private final CsvRecordCodec csvCodec = new CsvRecordCodec();

    @Test
    @DisplayName("Should record all feeds, skip the broken one and add nothing on a second run")
    void shouldRecordFeedsAndStayIdempotent() throws IOException {
        wireMockServer.stubFor(get(urlEqualTo("/news-rss")).willReturn(feed(NEWS_RSS, "application/rss+xml")));
        wireMockServer.stubFor(get(urlEqualTo("/broken")).willReturn(aResponse().withStatus(404)));
        wireMockServer.stubFor(get(urlEqualTo("/blog-atom")).willReturn(feed(BLOG_ATOM, "application/atom+xml")));

        Path config = writeConfig("/news-rss", "/broken", "/blog-atom");
        Path output = tempDir.resolve("data").resolve("feed_data.json");

        assertThat(feedRecorderJob.run(config, output)).isEqualTo(FeedRecorderJob.EXIT_OK);

        List<FeedRecord> firstRun = jsonCodec.read(output);
        assertThat(firstRun)
                .extracting(FeedRecord::entryUrl)
                .containsExactly(
                        "https://blog.example.com/shipping-faster",
                        "https://news.example.com/markets-close",
                        "https://news.example.com/summit-opens");
        assertThat(firstRun.get(0).timestamp()).isEqualTo("2006-01-05T12:00:00+00:00");
        assertThat(firstRun.get(0).author()).isEqualTo("Alex Kim");
        assertThat(firstRun.get(0).feedUrl()).isEqualTo(wireMockServer.baseUrl() + "/blog-atom");
        assertThat(firstRun.get(2).topics()).containsExactly("World");

        byte[] afterFirstRun = Files.readAllBytes(output);

        assertThat(feedRecorderJob.run(config, output)).isEqualTo(FeedRecorderJob.EXIT_OK);
        assertThat(Files.readAllBytes(output)).isEqualTo(afterFirstRun);
    }

    @Test
    @DisplayName("Should retry a temporarily unavailable feed and write CSV")
    void shouldRetryUnavailableFeed() throws IOException {
        wireMockServer.stubFor(get(urlEqualTo("/flaky"))
                .inScenario("flaky feed")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(503))
                .willSetStateTo("recovered"));
        wireMockServer.stubFor(get(urlEqualTo("/flaky"))
                .inScenario("flaky feed")
                .whenScenarioStateIs("recovered")
                .willReturn(feed(NEWS_RSS, "application/rss+xml")));

        Path config = writeConfig("/flaky");
        Path output = tempDir.resolve("feed_data.csv");

        assertThat(feedRecorderJob.run(config, output)).isEqualTo(FeedRecorderJob.EXIT_OK);

        wireMockServer.verify(2, getRequestedFor(urlEqualTo("/flaky")));
        assertThat(csvCodec.read(output))
                .extracting(FeedRecord::title)
                .containsExactly("Markets close higher", "Summit opens");
    }

    @Test
    @DisplayName("Should not retry a feed that is gone")
    void shouldNotRetryMissingFeed() throws IOException {
        wireMockServer.stubFor(get(urlEqualTo("/gone")).willReturn(aResponse().withStatus(404)));

        Path config = writeConfig("/gone");
        Path output = tempDir.resolve("feed_data.json");

        assertThat(feedRecorderJob.run(config, output)).isEqualTo(FeedRecorderJob.EXIT_OK);

        wireMockServer.verify(1, getRequestedFor(urlEqualTo("/gone")));
        assertThat(output).doesNotExist();
    }

    private Path writeConfig(String... paths) throws IOException {
        StringBuilder yaml = new StringBuilder("feed_urls:\n");
        for (String path : paths) {
            yaml.append("  - ").append(wireMockServer.baseUrl()).append(path).append('\n');
        }
        Path config = tempDir.resolve("feed_config.yaml");
        Files.writeString(config, yaml);
        return config;
    }

    private static ResponseDefinitionBuilder feed(String body, String contentType) {
        return aResponse()
                .withStatus(200)
                .withHeader("Content-Type", contentType + "; charset=UTF-8")
                .withBody(body);
    }
}
