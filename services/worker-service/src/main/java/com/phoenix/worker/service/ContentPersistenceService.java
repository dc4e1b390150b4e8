package com.phoenix.worker.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phoenix.worker.domain.ContentSourceEntity;
import com.phoenix.worker.domain.GeneratedContentEntity;
import com.phoenix.worker.domain.MediaAsset;
import com.phoenix.worker.domain.MediaAssetEntity;
import com.phoenix.worker.domain.ResearchFinding;
import com.phoenix.worker.repository.ContentSourceRepository;
import com.phoenix.worker.repository.GeneratedContentRepository;
import com.phoenix.worker.repository.MediaAssetRepository;
import jakarta.transaction.Transactional;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes the final content of an instance together with its sources and media in one transaction.
 * The instance id is the content id, so a repeated write returns the row written the first time.
 */
@Service
public class ContentPersistenceService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContentPersistenceService.class);

    private final GeneratedContentRepository contentRepository;
    private final ContentSourceRepository sourceRepository;
    private final MediaAssetRepository mediaRepository;
    private final ObjectMapper objectMapper;

    public ContentPersistenceService(
        GeneratedContentRepository contentRepository,
        ContentSourceRepository sourceRepository,
        MediaAssetRepository mediaRepository,
        ObjectMapper objectMapper
    ) {
        this.contentRepository = contentRepository;
        this.sourceRepository = sourceRepository;
        this.mediaRepository = mediaRepository;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public GeneratedContentEntity persist(PersistRequest request) {
        Optional<GeneratedContentEntity> existing = contentRepository.findById(request.instanceId());
        if (existing.isPresent()) {
            LOGGER.info("Content for instance {} already persisted, skipping write", request.instanceId());
            return existing.get();
        }

        GeneratedContentEntity content = contentRepository.save(GeneratedContentEntity.of(
            request.instanceId(),
            request.subject(),
            request.draft(),
            toPayload(request),
            request.coverage(),
            request.partialCoverage()
        ));

        UUID contentId = content.getInstanceId();
        List<ContentSourceEntity> sources = request.findings().stream()
            .filter(ResearchFinding::isUsable)
            .map(finding -> ContentSourceEntity.of(contentId, finding))
            .toList();
        sourceRepository.saveAll(sources);

        List<MediaAssetEntity> media = request.mediaAssets().stream()
            .map(asset -> MediaAssetEntity.of(contentId, asset))
            .toList();
        mediaRepository.saveAll(media);

        LOGGER.info("Persisted {} content {} with {} sources and {} media assets",
            request.subject().kind(), content.getSlug(), sources.size(), media.size());
        return content;
    }

    public List<MediaAsset> mediaFor(UUID contentId) {
        return mediaRepository.findByContentId(contentId).stream().map(MediaAssetEntity::toAsset).toList();
    }

    private String toPayload(PersistRequest request) {
        try {
            return objectMapper.writeValueAsString(request.draft());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize draft for instance " + request.instanceId(), ex);
        }
    }
}
