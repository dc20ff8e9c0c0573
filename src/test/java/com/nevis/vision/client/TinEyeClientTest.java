package com.nevis.vision.client;

import com.nevis.vision.model.ImageSource;
import com.nevis.vision.model.MatchTag;
import com.nevis.vision.model.ReverseSearchOptions;
import com.nevis.vision.model.SortField;
import com.nevis.vision.model.SortOrder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.hamcrest.Matchers.startsWith;

class TinEyeClientTest {

    private MockRestServiceServer server;
    private TinEyeClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://tineye.local/rest");
        server = MockRestServiceServer.bindTo(builder).build();
        RestClient restClient = builder.build();
        client = new TinEyeClient(restClient, restClient, "secret");
    }

    @Test
    void shouldPassSearchOptionsAsQueryParameters() {
        ReverseSearchOptions options = new ReverseSearchOptions(20, 40, SortField.CRAWL_DATE, SortOrder.ASC,
            "Example.com", Set.of(MatchTag.STOCK, MatchTag.COLLECTION), null);

        server.expect(requestTo(startsWith("https://tineye.local/rest/search/")))
            .andExpect(method(HttpMethod.GET))
            .andExpect(header(TinEyeClient.API_KEY_HEADER, "secret"))
            .andExpect(queryParam("image_url", "https://img.example.com/a.jpg"))
            .andExpect(queryParam("limit", "20"))
            .andExpect(queryParam("offset", "40"))
            .andExpect(queryParam("sort", "crawl_date"))
            .andExpect(queryParam("order", "asc"))
            .andExpect(queryParam("domain", "example.com"))
            .andExpect(queryParam("tags", "collection,stock"))
            .andRespond(withSuccess("{\"results\":{\"matches\":[]}}", MediaType.APPLICATION_JSON));

        client.search(ImageSource.ofUrl("https://img.example.com/a.jpg"), options);

        server.verify();
    }

    @Test
    void shouldUploadBytesAsMultipart() {
        server.expect(requestTo(startsWith("https://tineye.local/rest/search/")))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Content-Type", startsWith(MediaType.MULTIPART_FORM_DATA_VALUE)))
            .andRespond(withSuccess("{\"results\":{\"matches\":[]}}", MediaType.APPLICATION_JSON));

        client.search(ImageSource.ofBytes(new byte[]{1, 2, 3}), ReverseSearchOptions.defaults());

        server.verify();
    }

    @Test
    void shouldProbeImageCountEndpoint() {
        server.expect(requestTo("https://tineye.local/rest/image_count/"))
            .andExpect(header(TinEyeClient.API_KEY_HEADER, "secret"))
            .andRespond(withSuccess("{\"results\":123}", MediaType.APPLICATION_JSON));

        assertThat(client.check()).isTrue();
    }

    @Test
    void shouldNotBeConfiguredWithoutKey() {
        RestClient restClient = RestClient.create("https://tineye.local/rest");
        assertThat(new TinEyeClient(restClient, restClient, " ").isConfigured()).isFalse();
    }
}
