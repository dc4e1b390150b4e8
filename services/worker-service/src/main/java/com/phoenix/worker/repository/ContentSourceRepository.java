package com.phoenix.worker.repository;

import com.phoenix.worker.domain.ContentSourceEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ContentSourceRepository extends JpaRepository<ContentSourceEntity, UUID> {

    List<ContentSourceEntity> findByContentIdOrderByRelevanceDesc(UUID contentId);
}
