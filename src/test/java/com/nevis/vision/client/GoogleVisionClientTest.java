package com.nevis.vision.client;

import com.nevis.vision.model.ImageSource;
import com.nevis.vision.model.ReverseSearchOptions;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GoogleVisionClientTest {

    @Test
    void shouldRequestWebDetection() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://vision.local");
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        GoogleVisionClient client = new GoogleVisionClient(builder.build(), "key-1");

        server.expect(requestTo("https://vision.local/v1/images:annotate?key=key-1"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.requests[0].image.content").value("AQID"))
            .andExpect(jsonPath("$.requests[0].features[0].type").value("WEB_DETECTION"))
            .andExpect(jsonPath("$.requests[0].features[0].maxResults").value(GoogleVisionClient.MAX_RESULTS))
            .andRespond(withSuccess("{\"responses\":[{}]}", MediaType.APPLICATION_JSON));

        client.search(ImageSource.ofBytes(new byte[]{1, 2, 3}), ReverseSearchOptions.defaults());

        server.verify();
        assertThat(client.check()).isTrue();
    }
}
