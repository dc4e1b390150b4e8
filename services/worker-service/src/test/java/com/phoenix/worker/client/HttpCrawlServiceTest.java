package com.phoenix.worker.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.phoenix.worker.runtime.TransientActivityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class HttpCrawlServiceTest {

    private MockRestServiceServer server;
    private HttpCrawlService crawlService;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://crawl.test");
        server = MockRestServiceServer.bindTo(builder).build();
        crawlService = new HttpCrawlService("crawl4ai", builder.build(), "/crawl");
    }

    @Test
    @DisplayName("a successful crawl yields the page text and extracted facts")
    void success() {
        server.expect(requestTo("http://crawl.test/crawl"))
            .andExpect(jsonPath("$.url").value("https://acme.example/about"))
            .andRespond(withSuccess("""
                {"success":true,"url":"https://acme.example/about","title":"About Acme",
                 "content":"Acme Corp makes anvils in Phoenix.","facts":{"headquarters":"Phoenix"}}
                """, MediaType.APPLICATION_JSON));

        CrawlPage page = crawlService.fetch("https://acme.example/about");

        assertThat(page.title()).isEqualTo("About Acme");
        assertThat(page.facts()).containsEntry("headquarters", "Phoenix");
        assertThat(page.wordCount()).isEqualTo(6);
    }

    @Test
    @DisplayName("an unsuccessful crawl is a retryable failure")
    void unsuccessful() {
        server.expect(requestTo("http://crawl.test/crawl"))
            .andRespond(withSuccess("{\"success\":false,\"error\":\"blocked by robots.txt\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> crawlService.fetch("https://acme.example/about"))
            .isInstanceOf(TransientActivityException.class)
            .hasMessageContaining("blocked by robots.txt")
            .hasMessageContaining("crawl4ai");
    }
}
