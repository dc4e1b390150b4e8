package com.phoenix.worker.repository;

import com.phoenix.worker.domain.MediaAssetEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MediaAssetRepository extends JpaRepository<MediaAssetEntity, UUID> {

    List<MediaAssetEntity> findByContentId(UUID contentId);
}
