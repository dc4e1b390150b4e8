package com.phoenix.worker.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.doAnswer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phoenix.worker.domain.ContentDraft;
import com.phoenix.worker.domain.MediaAsset;
import com.phoenix.worker.domain.ResearchFinding;
import com.phoenix.worker.domain.SourceTier;
import com.phoenix.worker.domain.Subject;
import com.phoenix.worker.domain.WorkflowKind;
import com.phoenix.worker.repository.ContentSourceRepository;
import com.phoenix.worker.repository.GeneratedContentRepository;
import com.phoenix.worker.repository.MediaAssetRepository;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({ContentPersistenceService.class, ContentPersistenceRollbackTest.JsonConfig.class})
class ContentPersistenceRollbackTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private ContentPersistenceService persistenceService;

    @Autowired
    private GeneratedContentRepository contentRepository;

    @Autowired
    private ContentSourceRepository sourceRepository;

    @MockBean
    private MediaAssetRepository mediaRepository;

    @TestConfiguration
    static class JsonConfig {

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    @Test
    @DisplayName("a failed media insert rolls back the content row and its sources")
    void mediaFailureRollsBackEverything() {
        // given
        UUID instanceId = UUID.randomUUID();
        doAnswer(invocation -> {
            contentRepository.flush();
            throw new DataIntegrityViolationException("media_assets insert failed");
        }).when(mediaRepository).saveAll(anyIterable());

        // when
        assertThatThrownBy(() -> persistenceService.persist(request(instanceId)))
            .isInstanceOf(DataIntegrityViolationException.class);

        // then
        assertThat(contentRepository.findById(instanceId)).isEmpty();
        assertThat(sourceRepository.findByContentIdOrderByRelevanceDesc(instanceId)).isEmpty();
    }

    private static PersistRequest request(UUID instanceId) {
        Subject subject = Subject.of("Acme Corp", WorkflowKind.COMPANY, NOW);
        ContentDraft draft = new ContentDraft("Acme Corp", null, "Summary", "Body", Map.of(), List.of("anvils"), List.of());
        List<ResearchFinding> findings = List.of(
            new ResearchFinding("https://acme.example/about", SourceTier.CRAWLED_FULL, 1, 1.0,
                Map.of("overview", "Anvils"), "Acme makes anvils", 500, NOW),
            new ResearchFinding("https://news.example/acme", SourceTier.SEARCH_SNIPPET, 2, 0.9,
                Map.of(), "Snippet", 0, NOW)
        );
        return new PersistRequest(instanceId, subject, draft, findings,
            List.of(new MediaAsset("logo", "https://cdn.example/acme.png")), 0.9, false);
    }
}
