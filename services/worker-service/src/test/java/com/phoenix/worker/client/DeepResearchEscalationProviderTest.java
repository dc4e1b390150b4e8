package com.phoenix.worker.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.phoenix.worker.client.EscalationProvider.EscalationHit;
import com.phoenix.worker.client.EscalationProvider.EscalationRequest;
import com.phoenix.worker.domain.WorkflowKind;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class DeepResearchEscalationProviderTest {

    @Test
    @DisplayName("asks only for the missing fields and excludes urls already covered")
    void researchesGap() {
        // given
        RestClient.Builder builder = RestClient.builder().baseUrl("http://research.test");
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        DeepResearchEscalationProvider provider = new DeepResearchEscalationProvider(builder.build());
        server.expect(requestTo("http://research.test/v1/research/gap"))
            .andExpect(jsonPath("$.kind").value("company"))
            .andExpect(jsonPath("$.missing_fields[0]").value("key_people"))
            .andExpect(jsonPath("$.missing_fields[1]").value("recent_deals"))
            .andExpect(jsonPath("$.exclude_urls[0]").value("https://acme.example"))
            .andRespond(withSuccess("""
                {"results":[
                  {"url":"https://deals.example/acme","text":"Acme bought Roadrunner Inc.","facts":{"recent_deals":"Roadrunner Inc."},"score":0.7},
                  {"url":"","text":"dropped"}
                ]}
                """, MediaType.APPLICATION_JSON));

        // when
        List<EscalationHit> hits = provider.research(new EscalationRequest(
            "Acme Corp", WorkflowKind.COMPANY, Set.of("recent_deals", "key_people"), Set.of("https://acme.example")));

        // then
        assertThat(hits).singleElement().satisfies(hit -> {
            assertThat(hit.url()).isEqualTo("https://deals.example/acme");
            assertThat(hit.facts()).containsEntry("recent_deals", "Roadrunner Inc.");
            assertThat(hit.score()).isEqualTo(0.7);
        });
        server.verify();
    }
}
